package de.leidenheit.fixtura.core.execution;

import de.leidenheit.fixtura.core.model.Arguments;

/**
 * Called after a failed test was classified and reported, when dropping into a debugger is enabled.
 */
@FunctionalInterface
public interface FailureHook {

    FailureHook NONE = (displayName, failure, arguments) -> {
    };

    void onFailure(final String displayName, final Throwable failure, final Arguments arguments);
}
