package de.leidenheit.fixtura.core.execution;

import com.google.common.base.Throwables;
import de.leidenheit.fixtura.FixturaSession;
import de.leidenheit.fixtura.core.exception.FixturaInterruptException;
import de.leidenheit.fixtura.core.exception.FixtureProtocolViolationException;
import de.leidenheit.fixtura.core.execution.context.ExecutionContext;
import de.leidenheit.fixtura.core.execution.resolving.DependencyResolver;
import de.leidenheit.fixtura.core.execution.resolving.FixtureInvoker;
import de.leidenheit.fixtura.core.model.Arguments;
import de.leidenheit.fixtura.core.model.Fixture;
import de.leidenheit.fixtura.core.model.Outcome;
import de.leidenheit.fixtura.core.model.TestCase;
import de.leidenheit.fixtura.infrastructure.diagnostics.OutcomeReporter;
import de.leidenheit.fixtura.infrastructure.io.OutputCapture;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs one concrete invocation of a test: resolves its fixtures, calls the body with captured output,
 * classifies the outcome and always tears the invocation down.
 */
@Slf4j
public class TestExecutor {

    public static final String SUITE_DISPLAY_NAME = "module";

    private final FixturaSession session;
    private final DependencyResolver resolver;
    private final OutcomeReporter reporter;

    public TestExecutor(final FixturaSession session) {
        this(session,
                new DependencyResolver(session.getRegistry(), new FixtureInvoker()),
                new OutcomeReporter(session.getSink(), session.getSettings()));
    }

    public TestExecutor(final FixturaSession session, final DependencyResolver resolver, final OutcomeReporter reporter) {
        this.session = session;
        this.resolver = resolver;
        this.reporter = reporter;
    }

    public Outcome execute(final TestCase testCase, final String displayName, final ExecutionContext parent) {
        return execute(testCase, displayName, Arguments.empty(), parent);
    }

    /**
     * @throws FixtureProtocolViolationException after reporting and teardown, when a setup/teardown fixture
     *                                           broke its protocol; the run must not go on
     */
    public Outcome execute(final TestCase testCase,
                           final String displayName,
                           final Arguments literals,
                           final ExecutionContext parent) {
        if (testCase.isSkipped()) {
            log.debug("Skipping '{}'", displayName);
            session.getResults().incrementSkipped();
            return Outcome.SKIPPED;
        }

        var context = ExecutionContext.forFunction(parent, testCase);
        session.getRegistry().register(Fixture.builder()
                .name(ExecutionContext.REQUEST_FIXTURE)
                .provider(arguments -> context)
                .autouse(true)
                .build());

        Outcome outcome = Outcome.ABORTED;
        FixtureProtocolViolationException violation = null;
        try {
            outcome = run(testCase, displayName, literals, context);
        } catch (FixtureProtocolViolationException e) {
            violation = e;
        } finally {
            session.restoreWorkingDirectory();
            violation = tearDown(context, displayName, violation);
        }
        if (violation != null) {
            throw violation;
        }
        return outcome;
    }

    /**
     * Tears down a suite level context. Failures are reported under {@value #SUITE_DISPLAY_NAME}.
     *
     * @param earlier a violation already stopping the run, or {@code null}
     * @return the violation that stops the run, or {@code null} when there is none
     */
    public FixtureProtocolViolationException tearDownSuite(final ExecutionContext suiteContext,
                                                           final FixtureProtocolViolationException earlier) {
        return tearDown(suiteContext, SUITE_DISPLAY_NAME, earlier);
    }

    private Outcome run(final TestCase testCase,
                        final String displayName,
                        final Arguments literals,
                        final ExecutionContext context) {
        reporter.started(displayName);

        Arguments bound = literals;
        var capture = OutputCapture.start();
        try {
            try {
                bound = resolver.resolve(testCase, literals, context);
                testCase.getBody().run(bound);
            } finally {
                capture.close();
            }
            reporter.success();
            session.getResults().incrementSuccess();
            return Outcome.SUCCESS;
        } catch (FixtureProtocolViolationException e) {
            reporter.protocolViolation(displayName, e);
            session.getResults().incrementAbort();
            throw e;
        } catch (FixturaInterruptException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.debug("'{}' was interrupted", displayName);
            reporter.aborted();
            session.getResults().incrementAbort();
            return Outcome.ABORTED;
        } catch (Throwable t) {
            Throwables.throwIfInstanceOf(t, VirtualMachineError.class);
            reporter.failure(displayName, t, capture.getStdout(), capture.getStderr(), bound);
            if (session.getSettings().isDropIntoDebugger()) {
                session.getFailureHook().onFailure(displayName, t, bound);
            }
            session.getResults().incrementFailed();
            return Outcome.FAILED;
        }
    }

    private FixtureProtocolViolationException tearDown(final ExecutionContext context,
                                                       final String displayName,
                                                       final FixtureProtocolViolationException earlier) {
        try {
            List<Exception> failures = context.teardown();
            if (!failures.isEmpty()) {
                reporter.teardownFailures(displayName, failures);
                session.getResults().incrementFailed();
            }
            return earlier;
        } catch (FixtureProtocolViolationException e) {
            reporter.protocolViolation(displayName, e);
            session.getResults().incrementAbort();
            if (earlier == null) {
                return e;
            }
            earlier.addSuppressed(e);
            return earlier;
        }
    }
}
