package io.devdash.dashboard;

import io.devdash.common.plugin.DashboardPlugin;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Plugins found on a class loader through {@code META-INF/services}, in discovery order.
 */
final class DashboardPlugins {

    private final List<DashboardPlugin> plugins;

    private DashboardPlugins(List<DashboardPlugin> plugins) {
        this.plugins = List.copyOf(plugins);
    }

    static DashboardPlugins discover(ClassLoader classLoader) {
        List<DashboardPlugin> found = new ArrayList<>();
        ServiceLoader.load(DashboardPlugin.class, classLoader).forEach(found::add);
        return new DashboardPlugins(found);
    }

    List<String> names() {
        return plugins.stream().map(DashboardPlugin::name).toList();
    }

    Set<String> configurationClassNames() {
        Set<String> names = new LinkedHashSet<>();
        for (DashboardPlugin plugin : plugins) {
            plugin.configurationClasses().stream()
                    .filter(Objects::nonNull)
                    .map(Class::getName)
                    .forEach(names::add);
        }
        return names;
    }
}
