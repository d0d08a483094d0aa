package io.devdash.common.plugin;

import java.util.Set;

/**
 * Extension point for dashboard plugins loaded via ServiceLoader.
 * A plugin contributes Spring configuration that declares its {@code DashboardModule} beans.
 */
public interface DashboardPlugin {

    /**
     * Human-readable plugin name used in startup logging.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Spring configuration classes to add to the dashboard application sources.
     */
    Set<Class<?>> configurationClasses();
}
