package de.leidenheit.fixtura.core.execution.context;

import de.leidenheit.fixtura.core.exception.FixturaIllegalStateException;
import de.leidenheit.fixtura.core.exception.FixtureProtocolViolationException;
import de.leidenheit.fixtura.core.model.Finalizer;
import de.leidenheit.fixtura.core.model.FixtureScope;
import de.leidenheit.fixtura.core.model.TestCase;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per test invocation state, exposed to fixtures under the name {@code request}.
 *
 * <p>Owns the finalizer stack, the per resolution result cache and the names of the fixtures used.
 * A context is never shared between two invocations.
 */
@Slf4j
public class ExecutionContext {

    public static final String REQUEST_FIXTURE = "request";

    @Getter
    private final FixtureScope scope;
    @Getter
    private final ExecutionContext parent;
    @Getter
    private final TestCase testCase;

    private final Set<String> fixtureNames = new LinkedHashSet<>();
    private final Deque<Finalizer> finalizers = new ArrayDeque<>();
    private final Map<String, Object> results = new HashMap<>();
    private final Set<String> additionalWantedFixtures = new LinkedHashSet<>();

    @Getter
    @Setter
    private String currentFixtureSetup;
    @Getter
    private boolean tornDown;

    public ExecutionContext(final FixtureScope scope, final ExecutionContext parent, final TestCase testCase) {
        this.scope = Objects.requireNonNull(scope, "scope");
        this.parent = parent;
        this.testCase = testCase;
    }

    public static ExecutionContext forModule() {
        return new ExecutionContext(FixtureScope.MODULE, null, null);
    }

    public static ExecutionContext forFunction(final ExecutionContext parent, final TestCase testCase) {
        return new ExecutionContext(FixtureScope.FUNCTION, parent, testCase);
    }

    public void addFinalizer(final Finalizer finalizer) {
        if (tornDown) {
            throw new FixturaIllegalStateException("Context of '%s' is already torn down".formatted(describe()));
        }
        finalizers.push(Objects.requireNonNull(finalizer, "finalizer"));
    }

    public int finalizerCount() {
        return finalizers.size();
    }

    /**
     * Asks for an extra fixture to be resolved for this invocation even though nobody declared it.
     */
    public void requestFixture(final String name) {
        additionalWantedFixtures.add(name);
    }

    public Set<String> getAdditionalWantedFixtures() {
        return Collections.unmodifiableSet(additionalWantedFixtures);
    }

    public Set<String> getFixtureNames() {
        return Collections.unmodifiableSet(fixtureNames);
    }

    public void markUsed(final String fixtureName) {
        fixtureNames.add(fixtureName);
    }

    public void replaceFixtureNames(final Set<String> names) {
        fixtureNames.clear();
        fixtureNames.addAll(names);
    }

    public boolean hasResult(final String fixtureName) {
        return results.containsKey(fixtureName);
    }

    /**
     * @return the raw result recorded for the fixture, which may be a {@link de.leidenheit.fixtura.core.model.Yield}
     */
    public Object getResult(final String fixtureName) {
        return results.get(fixtureName);
    }

    public void addResult(final String fixtureName, final Object rawResult) {
        results.put(fixtureName, rawResult);
    }

    /**
     * Runs every finalizer once, most recently added first. Later finalizers still run when one fails.
     *
     * @return failures of finalizers, in execution order
     * @throws FixtureProtocolViolationException once all finalizers ran, if any of them violated the
     *                                           setup/teardown protocol
     */
    public List<Exception> teardown() {
        if (tornDown) return List.of();
        tornDown = true;

        List<Exception> failures = new ArrayList<>();
        FixtureProtocolViolationException violation = null;
        while (!finalizers.isEmpty()) {
            var finalizer = finalizers.pop();
            try {
                finalizer.run();
            } catch (FixtureProtocolViolationException e) {
                if (violation == null) {
                    violation = e;
                } else {
                    violation.addSuppressed(e);
                }
            } catch (Exception e) {
                log.warn("Finalizer of '{}' failed: {}", describe(), e.toString());
                failures.add(e);
            }
        }
        if (violation != null) {
            failures.forEach(violation::addSuppressed);
            throw violation;
        }
        log.debug("Tore down {} context of '{}'", scope.label(), describe());
        return failures;
    }

    private String describe() {
        return testCase == null ? scope.label() : testCase.getName();
    }

    @Override
    public String toString() {
        return "<ExecutionContext scope=%s test=%s>".formatted(scope.label(), describe());
    }
}
