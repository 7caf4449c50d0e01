package de.leidenheit.fixtura.core.exception;

import lombok.Getter;

import java.util.Collection;

@Getter
public class UnknownFixtureException extends FixturesUnresolvableException {

    private final String fixtureName;

    public UnknownFixtureException() {
        super();
        this.fixtureName = null;
    }

    public UnknownFixtureException(final String message) {
        super(message);
        this.fixtureName = null;
    }

    public UnknownFixtureException(final String message, final Throwable cause) {
        super(message, cause);
        this.fixtureName = null;
    }

    public UnknownFixtureException(final Throwable cause) {
        super(cause);
        this.fixtureName = null;
    }

    public UnknownFixtureException(final String fixtureName,
                                   final Collection<String> pending,
                                   final Collection<String> resolved) {
        super("Fixture '%s' is not registered (pending: %s, available dependencies: %s)"
                .formatted(fixtureName, pending, resolved), pending, resolved);
        this.fixtureName = fixtureName;
    }
}
