package io.devdash.dashboard;

import org.springframework.context.annotation.DeferredImportSelector;
import org.springframework.core.type.AnnotationMetadata;

/**
 * Imports plugin configurations when the context is bootstrapped without {@link DashboardApplication#main},
 * as slice and integration tests are.
 */
public final class DashboardPluginImportSelector implements DeferredImportSelector {

    @Override
    public String[] selectImports(AnnotationMetadata importingClassMetadata) {
        return DashboardPlugins.discover(Thread.currentThread().getContextClassLoader())
                .configurationClassNames()
                .toArray(String[]::new);
    }
}
