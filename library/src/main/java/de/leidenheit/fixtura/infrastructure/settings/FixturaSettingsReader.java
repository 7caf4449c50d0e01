package de.leidenheit.fixtura.infrastructure.settings;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.google.common.base.Strings;
import de.leidenheit.fixtura.core.exception.FixturaSettingsException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;

/**
 * Reads {@link FixturaSettings} from a YAML file and applies overrides from system properties.
 */
@Slf4j
public final class FixturaSettingsReader {

    public static final String PROPERTY_SETTINGS_FILE = "fixtura.settings.file";
    public static final String PROPERTY_VERBOSE = "fixtura.verbose";
    public static final String PROPERTY_QUIET = "fixtura.quiet";
    public static final String PROPERTY_FAIL_FAST = "fixtura.fail-fast";
    public static final String PROPERTY_ANALYZE_ASSERTIONS = "fixtura.analyze-assertions";

    private static final YAMLMapper MAPPER = configuredMapper();

    private FixturaSettingsReader() {
    }

    /**
     * Reads the file named by {@value #PROPERTY_SETTINGS_FILE}, falling back to defaults when it is not set.
     */
    public static FixturaSettings readFromSystemProperties() {
        return readFromSystemProperties(System.getProperties());
    }

    static FixturaSettings readFromSystemProperties(final Properties properties) {
        var location = properties.getProperty(PROPERTY_SETTINGS_FILE);
        var settings = Strings.isNullOrEmpty(location)
                ? FixturaSettings.ofDefault()
                : readFile(Path.of(location));
        return applyOverrides(settings, properties);
    }

    public static FixturaSettings read(final Path path) {
        return applyOverrides(readFile(path), System.getProperties());
    }

    public static FixturaSettings load(final String content) {
        if (Strings.isNullOrEmpty(content) || content.isBlank()) return FixturaSettings.ofDefault();
        try {
            var settings = MAPPER.readValue(content, FixturaSettings.class);
            return settings == null ? FixturaSettings.ofDefault() : settings;
        } catch (IOException e) {
            throw new FixturaSettingsException("Settings are malformed: %s".formatted(e.getMessage()), e);
        }
    }

    private static FixturaSettings readFile(final Path path) {
        if (!Files.isRegularFile(path)) {
            log.debug("No settings file at '{}', using defaults", path);
            return FixturaSettings.ofDefault();
        }
        try {
            log.debug("Reading settings from '{}'", path);
            return load(Files.readString(path));
        } catch (IOException e) {
            throw new FixturaSettingsException("Settings file '%s' could not be read".formatted(path), e);
        }
    }

    static FixturaSettings applyOverrides(final FixturaSettings settings, final Properties properties) {
        var result = settings.toBuilder().build();
        readFlag(properties, PROPERTY_VERBOSE).ifPresent(result::setVerbose);
        readFlag(properties, PROPERTY_QUIET).ifPresent(result::setQuiet);
        readFlag(properties, PROPERTY_FAIL_FAST).ifPresent(result::setFailFast);
        readFlag(properties, PROPERTY_ANALYZE_ASSERTIONS).ifPresent(result::setAnalyzeAssertions);
        return result;
    }

    private static Optional<Boolean> readFlag(final Properties properties, final String property) {
        var value = properties.getProperty(property);
        if (Strings.isNullOrEmpty(value)) return Optional.empty();

        log.debug("Reading system property '{}': {}", property, value);
        return Optional.of(Boolean.parseBoolean(value.trim()));
    }

    private static YAMLMapper configuredMapper() {
        YAMLMapper mapper = new YAMLMapper();

        mapper
                // deserialization
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.FAIL_ON_IGNORED_PROPERTIES)
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                // YAML specific
                .enable(JsonParser.Feature.ALLOW_COMMENTS)
                .enable(JsonParser.Feature.ALLOW_SINGLE_QUOTES)
                .enable(JsonParser.Feature.ALLOW_YAML_COMMENTS);

        return mapper;
    }
}
