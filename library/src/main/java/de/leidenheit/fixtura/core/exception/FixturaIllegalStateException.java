package de.leidenheit.fixtura.core.exception;

public class FixturaIllegalStateException extends RuntimeException {

    public FixturaIllegalStateException() {
        super();
    }

    public FixturaIllegalStateException(final String message) {
        super(message);
    }

    public FixturaIllegalStateException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public FixturaIllegalStateException(final Throwable cause) {
        super(cause);
    }
}
