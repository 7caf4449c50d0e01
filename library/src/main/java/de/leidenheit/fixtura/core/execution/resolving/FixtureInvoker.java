package de.leidenheit.fixtura.core.execution.resolving;

import de.leidenheit.fixtura.core.exception.FixtureProtocolViolationException;
import de.leidenheit.fixtura.core.execution.context.ExecutionContext;
import de.leidenheit.fixtura.core.model.Arguments;
import de.leidenheit.fixtura.core.model.Fixture;
import de.leidenheit.fixtura.core.model.Yield;
import lombok.extern.slf4j.Slf4j;

/**
 * Calls a fixture provider at most once per context and schedules the teardown of setup/teardown fixtures.
 */
@Slf4j
public class FixtureInvoker {

    public Object invoke(final Fixture fixture, final ExecutionContext context, final Arguments arguments) throws Exception {
        var name = fixture.getName();
        if (context.hasResult(name)) {
            return unwrap(context.getResult(name));
        }

        Object result;
        context.setCurrentFixtureSetup(name);
        try {
            log.debug("Setting up fixture '{}' with {}", name, arguments.names());
            result = fixture.getProvider().provide(arguments);
        } finally {
            context.setCurrentFixtureSetup(null);
        }
        context.addResult(name, result);

        if (result instanceof Yield<?> guard) {
            if (guard.isResumed()) {
                // handed out again after its teardown already ran
                throw new FixtureProtocolViolationException(name);
            }
            context.addFinalizer(() -> {
                log.debug("Tearing down fixture '{}'", name);
                guard.resume(name);
            });
            return guard.getValue();
        }
        return result;
    }

    private static Object unwrap(final Object result) {
        return result instanceof Yield<?> guard ? guard.getValue() : result;
    }
}
