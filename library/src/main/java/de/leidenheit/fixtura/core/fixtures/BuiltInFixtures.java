package de.leidenheit.fixtura.core.fixtures;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import de.leidenheit.fixtura.core.model.Yield;
import de.leidenheit.fixtura.core.registry.FixtureRegistry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Fixtures available in every session.
 */
public final class BuiltInFixtures {

    public static final String TMP_PATH = "tmp_path";
    public static final String SYSTEM_PROPERTIES = "system_properties";

    private BuiltInFixtures() {
    }

    public static void registerAll(final FixtureRegistry registry) {
        registry.register(TMP_PATH, arguments -> tmpPath());
        registry.register(SYSTEM_PROPERTIES, arguments -> systemProperties());
    }

    static Yield<Path> tmpPath() throws Exception {
        var directory = Files.createTempDirectory("fixtura-");
        return Yield.of(directory, () -> {
            if (Files.exists(directory)) {
                MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
            }
        });
    }

    static Yield<Properties> systemProperties() {
        var snapshot = new Properties();
        snapshot.putAll(System.getProperties());
        return Yield.of(System.getProperties(), () -> System.setProperties(snapshot));
    }
}
