package de.leidenheit.fixtura.core.model;

/**
 * One concrete call of a test: its display name and the literal arguments bound for it.
 */
public record Invocation(String displayName, Arguments arguments) {
}
