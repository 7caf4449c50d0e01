package de.leidenheit.fixtura.infrastructure.plugin;

import com.google.common.base.Throwables;
import de.leidenheit.fixtura.FixturaSession;
import de.leidenheit.fixtura.core.exception.FixturaIllegalStateException;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.InvocationTargetException;

/**
 * Instantiates and configures the plugins named in the settings, in order.
 */
@Slf4j
public class PluginLoader {

    private final FixturaSession session;

    public PluginLoader(final FixturaSession session) {
        this.session = session;
    }

    public void loadAll() {
        for (String pluginClassName : session.getSettings().getPlugins()) {
            load(pluginClassName.trim());
            if (session.getRunController().shouldStop()) {
                return;
            }
        }
    }

    /**
     * @return {@code true} if the plugin was configured, {@code false} if loading failed and was reported
     */
    public boolean load(final String pluginClassName) {
        try {
            var plugin = instantiate(pluginClassName);
            plugin.configure(session.getRegistry(), session.getSettings());
            log.debug("Loaded plugin '{}'", pluginClassName);
            return true;
        } catch (Exception | LinkageError e) {
            log.warn("Loading plugin '{}' failed", pluginClassName, e);
            session.getSink().println("Loading plugin %s failed: ".formatted(pluginClassName));
            session.getSink().println(Throwables.getStackTraceAsString(e));
            session.getResults().incrementAbort();
            return false;
        }
    }

    private FixturePlugin instantiate(final String pluginClassName) throws ReflectiveOperationException {
        var loader = Thread.currentThread().getContextClassLoader();
        var pluginClass = Class.forName(pluginClassName, true, loader != null ? loader : getClass().getClassLoader());
        if (!FixturePlugin.class.isAssignableFrom(pluginClass)) {
            throw new FixturaIllegalStateException("%s does not implement %s"
                    .formatted(pluginClassName, FixturePlugin.class.getName()));
        }
        try {
            return pluginClass.asSubclass(FixturePlugin.class).getDeclaredConstructor().newInstance();
        } catch (InvocationTargetException e) {
            throw new FixturaIllegalStateException("Plugin %s could not be created".formatted(pluginClassName), e.getCause());
        }
    }
}
