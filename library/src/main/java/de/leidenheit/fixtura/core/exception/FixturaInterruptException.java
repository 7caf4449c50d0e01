package de.leidenheit.fixtura.core.exception;

public class FixturaInterruptException extends RuntimeException {

    public FixturaInterruptException() {
        super();
    }

    public FixturaInterruptException(final String message) {
        super(message);
    }

    public FixturaInterruptException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public FixturaInterruptException(final Throwable cause) {
        super(cause);
    }
}
