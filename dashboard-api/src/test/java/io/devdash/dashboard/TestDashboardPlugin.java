package io.devdash.dashboard;

import io.devdash.common.plugin.DashboardPlugin;

import java.util.Set;

public class TestDashboardPlugin implements DashboardPlugin {
    @Override
    public Set<Class<?>> configurationClasses() {
        return Set.of(TestPluginConfiguration.class);
    }
}
