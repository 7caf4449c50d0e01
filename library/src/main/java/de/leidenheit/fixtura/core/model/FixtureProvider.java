package de.leidenheit.fixtura.core.model;

/**
 * Produces the value of a fixture from the values of its declared dependencies.
 *
 * <p>A plain provider returns the value itself. A setup/teardown provider returns a {@link Yield}
 * carrying the value together with the cleanup to run once the test is done.
 */
@FunctionalInterface
public interface FixtureProvider {

    Object provide(final Arguments arguments) throws Exception;
}
