package de.leidenheit.fixtura.infrastructure.plugin;

import de.leidenheit.fixtura.core.registry.FixtureRegistry;
import de.leidenheit.fixtura.infrastructure.settings.FixturaSettings;

/**
 * Contributes fixtures before a run starts. Implementations need a public no-argument constructor.
 */
public interface FixturePlugin {

    void configure(final FixtureRegistry registry, final FixturaSettings settings) throws Exception;
}
