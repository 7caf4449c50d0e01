package de.leidenheit.fixtura.core.model;

import de.leidenheit.fixtura.core.exception.FixtureProtocolViolationException;
import lombok.Getter;

import java.util.Objects;

/**
 * Value of a setup/teardown fixture. The teardown can be resumed exactly once.
 *
 * @param <T> type of the provided value
 */
public final class Yield<T> {

    @Getter
    private final T value;
    private final Finalizer teardown;
    private boolean resumed;

    private Yield(final T value, final Finalizer teardown) {
        this.value = value;
        this.teardown = Objects.requireNonNull(teardown, "teardown");
    }

    public static <T> Yield<T> of(final T value, final Finalizer teardown) {
        return new Yield<>(value, teardown);
    }

    public boolean isResumed() {
        return resumed;
    }

    /**
     * Runs the cleanup part of the fixture.
     *
     * @throws FixtureProtocolViolationException if the teardown was already resumed
     */
    public void resume(final String fixtureName) throws Exception {
        if (resumed) {
            throw new FixtureProtocolViolationException(fixtureName);
        }
        resumed = true;
        teardown.run();
    }
}
