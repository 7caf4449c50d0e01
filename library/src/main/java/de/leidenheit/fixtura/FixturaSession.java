package de.leidenheit.fixtura;

import de.leidenheit.fixtura.core.execution.FailureHook;
import de.leidenheit.fixtura.core.execution.RunController;
import de.leidenheit.fixtura.core.execution.context.RunResults;
import de.leidenheit.fixtura.core.fixtures.BuiltInFixtures;
import de.leidenheit.fixtura.core.registry.FixtureRegistry;
import de.leidenheit.fixtura.infrastructure.io.OutputSink;
import de.leidenheit.fixtura.infrastructure.io.PrintStreamOutputSink;
import de.leidenheit.fixtura.infrastructure.plugin.PluginLoader;
import de.leidenheit.fixtura.infrastructure.settings.FixturaSettings;
import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * Everything one run shares: fixture registry, outcome counters, settings and the output sink.
 * Independent sessions do not interfere with each other.
 */
@Getter
public class FixturaSession {

    private static final String WORKING_DIRECTORY_PROPERTY = "user.dir";

    private final FixtureRegistry registry;
    private final RunResults results;
    private final FixturaSettings settings;
    private final OutputSink sink;
    private final FailureHook failureHook;
    private final RunController runController;
    private final String workingDirectory;

    @Builder
    private FixturaSession(final FixtureRegistry registry,
                           final RunResults results,
                           final FixturaSettings settings,
                           final OutputSink sink,
                           final FailureHook failureHook) {
        this.registry = Objects.requireNonNullElseGet(registry, FixtureRegistry::new);
        this.results = Objects.requireNonNullElseGet(results, RunResults::new);
        this.settings = Objects.requireNonNullElseGet(settings, FixturaSettings::ofDefault);
        this.sink = Objects.requireNonNullElseGet(sink, PrintStreamOutputSink::ofStdout);
        this.failureHook = Objects.requireNonNullElse(failureHook, FailureHook.NONE);
        this.runController = new RunController(this.results, this.settings.isFailFast());
        this.workingDirectory = System.getProperty(WORKING_DIRECTORY_PROPERTY);
    }

    /**
     * Creates a session with the built-in fixtures registered and the configured plugins loaded.
     */
    public static FixturaSession open(final FixturaSettings settings) {
        return open(settings, PrintStreamOutputSink.ofStdout());
    }

    public static FixturaSession open(final FixturaSettings settings, final OutputSink sink) {
        var session = FixturaSession.builder()
                .settings(settings)
                .sink(sink)
                .build();
        BuiltInFixtures.registerAll(session.getRegistry());
        new PluginLoader(session).loadAll();
        return session;
    }

    /**
     * Tests may change the working directory; put back the one recorded when the session started.
     */
    public void restoreWorkingDirectory() {
        if (workingDirectory != null) {
            System.setProperty(WORKING_DIRECTORY_PROPERTY, workingDirectory);
        }
    }
}
