package de.leidenheit.fixtura.core.exception;

public class FixturaUnsupportedException extends RuntimeException {

    public FixturaUnsupportedException() {
        super();
    }

    public FixturaUnsupportedException(final String message) {
        super(message);
    }

    public FixturaUnsupportedException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public FixturaUnsupportedException(final Throwable cause) {
        super(cause);
    }
}
