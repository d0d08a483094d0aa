package io.devdash.dashboard.registry;

import io.devdash.common.module.DashboardModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Freezes every {@link DashboardModule} bean into the registry before the web server starts.
 * Bean order ({@code @Order}) is the registration order and therefore the navigation order.
 */
@Configuration
public class ModuleRegistryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ModuleRegistryConfiguration.class);

    @Bean
    public ModuleRegistry moduleRegistry(ObjectProvider<DashboardModule> modules) {
        ModuleRegistry.Builder builder = ModuleRegistry.builder();
        modules.orderedStream().forEach(builder::register);
        ModuleRegistry registry = builder.build();
        log.info("Registered dashboard modules: {}", registry.entries().stream()
                .map(entry -> entry.name() + "=" + entry.contentPath())
                .toList());
        return registry;
    }
}
