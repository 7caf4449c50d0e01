package de.leidenheit.fixtura.core.exception;

import lombok.Getter;

import java.util.Collection;
import java.util.List;

/**
 * Raised when the dependency resolver cannot make any further progress for a test.
 * Fatal to the current test only.
 */
@Getter
public class FixturesUnresolvableException extends RuntimeException {

    private final List<String> pending;
    private final List<String> resolved;

    public FixturesUnresolvableException() {
        super();
        this.pending = List.of();
        this.resolved = List.of();
    }

    public FixturesUnresolvableException(final String message) {
        super(message);
        this.pending = List.of();
        this.resolved = List.of();
    }

    public FixturesUnresolvableException(final String message, final Throwable cause) {
        super(message, cause);
        this.pending = List.of();
        this.resolved = List.of();
    }

    public FixturesUnresolvableException(final Throwable cause) {
        super(cause);
        this.pending = List.of();
        this.resolved = List.of();
    }

    public FixturesUnresolvableException(final Collection<String> pending, final Collection<String> resolved) {
        super("Could not resolve fixtures any more, have %s left.%nAvailable dependencies: %s"
                .formatted(pending, resolved));
        this.pending = List.copyOf(pending);
        this.resolved = List.copyOf(resolved);
    }

    protected FixturesUnresolvableException(final String message,
                                            final Collection<String> pending,
                                            final Collection<String> resolved) {
        super(message);
        this.pending = List.copyOf(pending);
        this.resolved = List.copyOf(resolved);
    }
}
