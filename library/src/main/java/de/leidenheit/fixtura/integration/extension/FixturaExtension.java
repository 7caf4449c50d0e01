package de.leidenheit.fixtura.integration.extension;

import de.leidenheit.fixtura.FixturaSession;
import de.leidenheit.fixtura.infrastructure.settings.FixturaSettings;
import de.leidenheit.fixtura.infrastructure.settings.FixturaSettingsReader;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;

import java.util.HashMap;
import java.util.Map;

/**
 * Injects a {@link FixturaSession} opened with the settings named by {@code fixtura.settings.file}.
 */
@Slf4j
public class FixturaExtension implements BeforeAllCallback, ParameterResolver {

    private final Map<Class<?>, Object> supportedParameterTypes = new HashMap<>();

    @Override
    public void beforeAll(final ExtensionContext context) {
        var settings = FixturaSettingsReader.readFromSystemProperties();
        log.debug("Opening session for '{}' with {}", context.getDisplayName(), settings);
        supportedParameterTypes.put(FixturaSettings.class, settings);
        supportedParameterTypes.put(FixturaSession.class, FixturaSession.open(settings));
    }

    @Override
    public boolean supportsParameter(final ParameterContext parameterContext, final ExtensionContext extensionContext)
            throws ParameterResolutionException {
        return supportedParameterTypes.containsKey(parameterContext.getParameter().getType());
    }

    @Override
    public Object resolveParameter(final ParameterContext parameterContext, final ExtensionContext extensionContext)
            throws ParameterResolutionException {
        return supportedParameterTypes.get(parameterContext.getParameter().getType());
    }
}
