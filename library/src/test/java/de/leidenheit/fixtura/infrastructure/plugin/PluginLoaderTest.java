package de.leidenheit.fixtura.infrastructure.plugin;

import de.leidenheit.fixtura.FixturaSession;
import de.leidenheit.fixtura.core.registry.FixtureRegistry;
import de.leidenheit.fixtura.infrastructure.io.BufferedOutputSink;
import de.leidenheit.fixtura.infrastructure.settings.FixturaSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PluginLoaderTest {

    public static class GreetingPlugin implements FixturePlugin {
        @Override
        public void configure(final FixtureRegistry registry, final FixturaSettings settings) {
            registry.register("greeting", arguments -> settings.isVerbose() ? "Hello, verbose world" : "Hello");
        }
    }

    public static class BrokenPlugin implements FixturePlugin {
        @Override
        public void configure(final FixtureRegistry registry, final FixturaSettings settings) throws Exception {
            throw new IllegalStateException("database unavailable");
        }
    }

    public static class NotAPlugin {
    }

    private final BufferedOutputSink sink = new BufferedOutputSink();

    private FixturaSession session(final boolean failFast, final String... plugins) {
        return FixturaSession.builder()
                .sink(sink)
                .settings(FixturaSettings.builder().failFast(failFast).plugins(List.of(plugins)).build())
                .build();
    }

    @Test
    void testLoadsConfiguredPlugin() {
        // given
        var session = session(false, GreetingPlugin.class.getName());

        // when
        new PluginLoader(session).loadAll();

        // then
        assertThat(session.getRegistry().contains("greeting")).isTrue();
        assertThat(session.getResults().getAbort()).isZero();
        assertThat(sink.getContent()).isEmpty();
    }

    @Test
    void testFailingPluginIsReportedAsAbort() {
        // given
        var session = session(false, BrokenPlugin.class.getName(), GreetingPlugin.class.getName());

        // when
        new PluginLoader(session).loadAll();

        // then
        assertThat(session.getResults().getAbort()).isEqualTo(1);
        assertThat(sink.getContent())
                .contains("Loading plugin " + BrokenPlugin.class.getName() + " failed: ")
                .contains("database unavailable");
        assertThat(session.getRegistry().contains("greeting")).isTrue();
    }

    @Test
    void testUnknownAndIncompatibleClassesAreReported() {
        // given
        var loader = new PluginLoader(session(false));

        // when & then
        assertThat(loader.load("com.example.DoesNotExist")).isFalse();
        assertThat(loader.load(NotAPlugin.class.getName())).isFalse();
        assertThat(sink.getContent())
                .contains("ClassNotFoundException")
                .contains("does not implement " + FixturePlugin.class.getName());
    }

    @Test
    void testFailFastStopsLoading() {
        // given
        var session = session(true, BrokenPlugin.class.getName(), GreetingPlugin.class.getName());

        // when
        new PluginLoader(session).loadAll();

        // then
        assertThat(session.getResults().getAbort()).isEqualTo(1);
        assertThat(session.getRegistry().contains("greeting")).isFalse();
    }
}
