package io.devdash.modules.localcontent;

import io.devdash.common.plugin.DashboardPlugin;

import java.util.Set;

public final class LocalContentPlugin implements DashboardPlugin {
    @Override
    public Set<Class<?>> configurationClasses() {
        return Set.of(LocalContentConfiguration.class);
    }
}
