package de.leidenheit.fixtura.core.fixtures;

import de.leidenheit.fixtura.FixturaSession;
import de.leidenheit.fixtura.core.execution.TestExecutor;
import de.leidenheit.fixtura.core.execution.context.ExecutionContext;
import de.leidenheit.fixtura.core.model.Outcome;
import de.leidenheit.fixtura.core.model.TestCase;
import de.leidenheit.fixtura.core.registry.FixtureRegistry;
import de.leidenheit.fixtura.infrastructure.io.BufferedOutputSink;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltInFixturesTest {

    @Test
    void testRegistersBuiltIns() {
        // given
        var registry = new FixtureRegistry();

        // when
        BuiltInFixtures.registerAll(registry);

        // then
        assertThat(registry.names()).containsExactly(BuiltInFixtures.TMP_PATH, BuiltInFixtures.SYSTEM_PROPERTIES);
        assertThat(registry.autouseNames()).isEmpty();
    }

    @Test
    void testTmpPathIsDeletedWithItsContent() throws Exception {
        // given
        var guard = BuiltInFixtures.tmpPath();
        var directory = guard.getValue();
        Files.createDirectories(directory.resolve("nested"));
        Files.writeString(directory.resolve("nested/file.txt"), "content");

        // when
        guard.resume(BuiltInFixtures.TMP_PATH);

        // then
        assertThat(directory).doesNotExist();
    }

    @Test
    void testSystemPropertiesAreRestored() throws Exception {
        // given
        var guard = BuiltInFixtures.systemProperties();
        Properties properties = guard.getValue();

        // when
        properties.setProperty("fixtura.test.changed", "yes");
        guard.resume(BuiltInFixtures.SYSTEM_PROPERTIES);

        // then
        assertThat(System.getProperty("fixtura.test.changed")).isNull();
    }

    @Test
    void testTestsReceiveTmpPath() {
        // given
        var session = FixturaSession.builder().sink(new BufferedOutputSink()).build();
        BuiltInFixtures.registerAll(session.getRegistry());
        var seen = new AtomicReference<Path>();
        var test = TestCase.builder()
                .name("writes")
                .parameter(BuiltInFixtures.TMP_PATH)
                .body(arguments -> {
                    var directory = arguments.get(BuiltInFixtures.TMP_PATH, Path.class);
                    Files.writeString(directory.resolve("out.txt"), "data");
                    seen.set(directory);
                })
                .build();

        // when
        var outcome = new TestExecutor(session).execute(test, "writes", ExecutionContext.forModule());

        // then
        assertThat(outcome).isEqualTo(Outcome.SUCCESS);
        assertThat(seen.get()).isNotNull().doesNotExist();
    }
}
