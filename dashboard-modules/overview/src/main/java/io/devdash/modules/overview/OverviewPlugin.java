package io.devdash.modules.overview;

import io.devdash.common.plugin.DashboardPlugin;

import java.util.Set;

public final class OverviewPlugin implements DashboardPlugin {
    @Override
    public Set<Class<?>> configurationClasses() {
        return Set.of(OverviewConfiguration.class);
    }
}
