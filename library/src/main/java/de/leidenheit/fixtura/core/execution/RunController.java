package de.leidenheit.fixtura.core.execution;

import de.leidenheit.fixtura.core.execution.context.RunResults;
import lombok.Getter;

/**
 * Decides whether further tests may start. Never interrupts a test that is already running.
 */
public class RunController {

    @Getter
    private final RunResults results;
    @Getter
    private final boolean failFast;

    public RunController(final RunResults results, final boolean failFast) {
        this.results = results;
        this.failFast = failFast;
    }

    public boolean shouldStop() {
        return failFast && (results.getFailed() > 0 || results.getAbort() > 0);
    }
}
