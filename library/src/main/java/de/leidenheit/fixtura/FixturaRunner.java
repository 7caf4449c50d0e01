package de.leidenheit.fixtura;

import de.leidenheit.fixtura.core.exception.FixtureProtocolViolationException;
import de.leidenheit.fixtura.core.execution.ParametrizeExpander;
import de.leidenheit.fixtura.core.execution.TestExecutor;
import de.leidenheit.fixtura.core.execution.context.ExecutionContext;
import de.leidenheit.fixtura.core.execution.context.RunResults;
import de.leidenheit.fixtura.core.model.TestCase;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Runs a list of tests in order within one session.
 */
@Slf4j
public class FixturaRunner {

    private final FixturaSession session;
    private final TestExecutor executor;
    private final ParametrizeExpander expander;

    public FixturaRunner(final FixturaSession session) {
        this(session, new TestExecutor(session));
    }

    public FixturaRunner(final FixturaSession session, final TestExecutor executor) {
        this.session = session;
        this.executor = executor;
        this.expander = new ParametrizeExpander(executor, session.getRunController());
    }

    /**
     * @throws FixtureProtocolViolationException after the suite was torn down and the summary printed,
     *                                           when a setup/teardown fixture broke its protocol
     */
    public RunResults run(final List<TestCase> tests) {
        var moduleContext = ExecutionContext.forModule();
        log.debug("Running {} tests", tests.size());
        FixtureProtocolViolationException violation = null;
        try {
            for (TestCase testCase : tests) {
                if (session.getRunController().shouldStop()) {
                    log.debug("Stopping run before '{}'", testCase.getName());
                    break;
                }
                executeTest(testCase, moduleContext);
            }
        } catch (FixtureProtocolViolationException e) {
            violation = e;
        } finally {
            violation = executor.tearDownSuite(moduleContext, violation);
        }

        var results = session.getResults();
        if (!session.getSettings().isVerbose()) {
            session.getSink().println();
        }
        session.getSink().println(results.summary());
        if (violation != null) {
            throw violation;
        }
        return results;
    }

    public void executeTest(final TestCase testCase, final ExecutionContext moduleContext) {
        if (testCase.isParametrized()) {
            expander.expand(testCase, moduleContext);
        } else {
            executor.execute(testCase, testCase.getName(), moduleContext);
        }
    }
}
