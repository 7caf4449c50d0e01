package de.leidenheit.fixtura.core.exception;

import lombok.Getter;

/**
 * A setup/teardown fixture was resumed for teardown more than once. This is a fixture authoring
 * defect and stops the whole run.
 */
@Getter
public class FixtureProtocolViolationException extends RuntimeException {

    private final String fixtureName;

    public FixtureProtocolViolationException(final String fixtureName) {
        super("Setup/teardown fixture '%s' was resumed more than once".formatted(fixtureName));
        this.fixtureName = fixtureName;
    }
}
