package de.leidenheit.fixtura.core.execution.resolving;

import de.leidenheit.fixtura.core.exception.FixturesUnresolvableException;
import de.leidenheit.fixtura.core.exception.UnknownFixtureException;
import de.leidenheit.fixtura.core.execution.context.ExecutionContext;
import de.leidenheit.fixtura.core.model.Arguments;
import de.leidenheit.fixtura.core.model.Fixture;
import de.leidenheit.fixtura.core.model.TestCase;
import de.leidenheit.fixtura.core.registry.FixtureRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the fixtures a test needs by repeated passes over a pending set.
 *
 * <p>A pending fixture is invoked as soon as all of its declared dependencies are resolved. Dependencies
 * that were not seeded (neither declared by the test, autouse nor {@code request}) are pulled into the
 * pending set when first seen, as are fixtures requested through the context while resolution runs.
 * Resolution fails once a full pass neither resolves nor activates anything.
 */
@Slf4j
public class DependencyResolver {

    private final FixtureRegistry registry;
    private final FixtureInvoker invoker;

    public DependencyResolver(final FixtureRegistry registry, final FixtureInvoker invoker) {
        this.registry = registry;
        this.invoker = invoker;
    }

    /**
     * @param testCase the test whose declared parameters are to be satisfied
     * @param literals values supplied by the caller, e.g. parametrize bindings; these win over fixtures
     * @param context  the context of the current invocation
     * @return the values for exactly the declared parameters of the test, followed by remaining literals
     */
    public Arguments resolve(final TestCase testCase,
                             final Arguments literals,
                             final ExecutionContext context) throws Exception {
        Map<String, Object> resolved = new LinkedHashMap<>();
        Map<String, Fixture> pending = seed(testCase, literals);

        while (!pending.isEmpty()) {
            boolean progress = false;
            for (Fixture fixture : List.copyOf(pending.values())) {
                progress |= activateMissingDependency(fixture, pending, resolved);

                if (resolved.keySet().containsAll(fixture.getDependencies())) {
                    // pending names are unique and leave pending once resolved
                    var name = fixture.getName();
                    var value = invoker.invoke(fixture, context, pick(resolved, fixture.getDependencies()));
                    resolved.put(name, value);
                    pending.remove(name);
                    context.markUsed(name);
                    activateWantedFixtures(context, pending, resolved);
                    progress = true;
                }
            }
            if (!progress) {
                throw new FixturesUnresolvableException(pending.keySet(), resolved.keySet());
            }
        }
        log.debug("Resolved fixtures {} for '{}'", resolved.keySet(), testCase.getName());
        context.replaceFixtureNames(resolved.keySet());

        Map<String, Object> arguments = new LinkedHashMap<>();
        for (String parameter : testCase.getParameters()) {
            if (resolved.containsKey(parameter)) {
                arguments.put(parameter, resolved.get(parameter));
            }
        }
        arguments.putAll(literals.asMap());
        return Arguments.of(arguments);
    }

    private Map<String, Fixture> seed(final TestCase testCase, final Arguments literals) {
        for (String parameter : testCase.getParameters()) {
            if (!registry.contains(parameter) && !literals.contains(parameter)) {
                throw new UnknownFixtureException(parameter, List.of(), List.of());
            }
        }

        var autouse = registry.autouseNames();
        Map<String, Fixture> pending = new LinkedHashMap<>();
        for (String name : registry.names()) {
            if (testCase.getParameters().contains(name)
                    || autouse.contains(name)
                    || ExecutionContext.REQUEST_FIXTURE.equals(name)) {
                registry.lookup(name).ifPresent(fixture -> pending.put(name, fixture));
            }
        }
        return pending;
    }

    /**
     * Puts the first dependency of the fixture that is neither resolved nor pending back into the pending set.
     */
    private boolean activateMissingDependency(final Fixture fixture,
                                              final Map<String, Fixture> pending,
                                              final Map<String, Object> resolved) {
        for (String dependency : fixture.getDependencies()) {
            if (!resolved.containsKey(dependency) && !pending.containsKey(dependency)) {
                pending.put(dependency, lookup(dependency, pending.keySet(), resolved.keySet()));
                return true;
            }
        }
        return false;
    }

    private void activateWantedFixtures(final ExecutionContext context,
                                        final Map<String, Fixture> pending,
                                        final Map<String, Object> resolved) {
        for (String wanted : context.getAdditionalWantedFixtures()) {
            if (!resolved.containsKey(wanted) && !pending.containsKey(wanted)) {
                pending.put(wanted, lookup(wanted, pending.keySet(), resolved.keySet()));
            }
        }
    }

    private Fixture lookup(final String name, final Collection<String> pending, final Collection<String> resolved) {
        return registry.lookup(name)
                .orElseThrow(() -> new UnknownFixtureException(name, new ArrayList<>(pending), new ArrayList<>(resolved)));
    }

    private static Arguments pick(final Map<String, Object> resolved, final List<String> names) {
        Map<String, Object> picked = new LinkedHashMap<>();
        names.forEach(name -> picked.put(name, resolved.get(name)));
        return Arguments.of(picked);
    }
}
