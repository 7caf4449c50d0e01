package de.leidenheit.fixtura.infrastructure.settings;

import de.leidenheit.fixtura.core.exception.FixturaSettingsException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FixturaSettingsReaderTest {

    @Test
    void testLoadReadsAllKeys() {
        // given
        var yaml = """
                # run settings
                verbose: true
                quiet: true
                fail-fast: true
                drop-into-debugger: true
                analyze-assertions: true
                source-roots:
                  - src/test/java
                plugins:
                  - com.example.DatabaseFixtures
                  - com.example.HttpFixtures
                """;

        // when
        var settings = FixturaSettingsReader.load(yaml);

        // then
        assertThat(settings.isVerbose()).isTrue();
        assertThat(settings.isQuiet()).isTrue();
        assertThat(settings.isFailFast()).isTrue();
        assertThat(settings.isDropIntoDebugger()).isTrue();
        assertThat(settings.isAnalyzeAssertions()).isTrue();
        assertThat(settings.getSourceRoots()).containsExactly("src/test/java");
        assertThat(settings.getPlugins()).containsExactly("com.example.DatabaseFixtures", "com.example.HttpFixtures");
    }

    @Test
    void testLoadAcceptsCamelCaseAndSingleValues() {
        // when
        var settings = FixturaSettingsReader.load("""
                failFast: true
                plugins: com.example.OnlyPlugin
                unknown: ignored
                """);

        // then
        assertThat(settings.isFailFast()).isTrue();
        assertThat(settings.isVerbose()).isFalse();
        assertThat(settings.getPlugins()).containsExactly("com.example.OnlyPlugin");
    }

    @Test
    void testBlankContentYieldsDefaults() {
        assertThat(FixturaSettingsReader.load("  \n")).isEqualTo(FixturaSettings.ofDefault());
        assertThat(FixturaSettingsReader.load(null)).isEqualTo(FixturaSettings.ofDefault());
    }

    @Test
    void testMalformedContentIsRejected() {
        assertThatThrownBy(() -> FixturaSettingsReader.load("verbose: [unclosed"))
                .isInstanceOf(FixturaSettingsException.class)
                .hasMessageStartingWith("Settings are malformed");
    }

    @Test
    void testMissingFileYieldsDefaults(@TempDir final Path directory) {
        // given
        var properties = new Properties();
        properties.setProperty(FixturaSettingsReader.PROPERTY_SETTINGS_FILE, directory.resolve("absent.yml").toString());

        // when
        var settings = FixturaSettingsReader.readFromSystemProperties(properties);

        // then
        assertThat(settings).isEqualTo(FixturaSettings.ofDefault());
    }

    @Test
    void testSystemPropertiesOverrideFile(@TempDir final Path directory) throws IOException {
        // given
        var file = directory.resolve("fixtura.yml");
        Files.writeString(file, "verbose: true\nfail-fast: false\n");
        var properties = new Properties();
        properties.setProperty(FixturaSettingsReader.PROPERTY_SETTINGS_FILE, file.toString());
        properties.setProperty(FixturaSettingsReader.PROPERTY_VERBOSE, "false");
        properties.setProperty(FixturaSettingsReader.PROPERTY_FAIL_FAST, " TRUE ");
        properties.setProperty(FixturaSettingsReader.PROPERTY_QUIET, "");

        // when
        var settings = FixturaSettingsReader.readFromSystemProperties(properties);

        // then
        assertThat(settings.isVerbose()).isFalse();
        assertThat(settings.isFailFast()).isTrue();
        assertThat(settings.isQuiet()).isFalse();
    }

    @Test
    void testOverridesDoNotModifyTheGivenSettings() {
        // given
        var original = FixturaSettings.ofDefault();
        var properties = new Properties();
        properties.setProperty(FixturaSettingsReader.PROPERTY_ANALYZE_ASSERTIONS, "true");

        // when
        var settings = FixturaSettingsReader.applyOverrides(original, properties);

        // then
        assertThat(settings.isAnalyzeAssertions()).isTrue();
        assertThat(original.isAnalyzeAssertions()).isFalse();
    }
}
