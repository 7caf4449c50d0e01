package de.leidenheit.fixtura.core.exception;

public class FixturaSettingsException extends RuntimeException {

    public FixturaSettingsException() {
        super();
    }

    public FixturaSettingsException(final String message) {
        super(message);
    }

    public FixturaSettingsException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public FixturaSettingsException(final Throwable cause) {
        super(cause);
    }
}
