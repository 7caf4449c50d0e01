package de.leidenheit.fixtura.core.execution.context;

import lombok.Getter;

/**
 * Outcome counters of one run. Counters only ever grow.
 */
@Getter
public class RunResults {

    private int success;
    private int failed;
    private int skipped;
    private int abort;

    public void incrementSuccess() {
        success++;
    }

    public void incrementFailed() {
        failed++;
    }

    public void incrementSkipped() {
        skipped++;
    }

    public void incrementAbort() {
        abort++;
    }

    public int total() {
        return success + failed + skipped + abort;
    }

    public String summary() {
        return "%d succeeded, %d failed, %d skipped, %d aborted".formatted(success, failed, skipped, abort);
    }

    @Override
    public String toString() {
        return "RunResults{success=%d, failed=%d, skipped=%d, abort=%d}".formatted(success, failed, skipped, abort);
    }
}
