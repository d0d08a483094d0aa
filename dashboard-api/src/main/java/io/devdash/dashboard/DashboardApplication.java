package io.devdash.dashboard;

import io.devdash.dashboard.config.ApiProperties;
import io.devdash.dashboard.config.KubernetesProperties;
import io.devdash.dashboard.config.NavigationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Import;

import java.util.LinkedHashSet;
import java.util.Set;

@SpringBootApplication
@EnableConfigurationProperties({ApiProperties.class, NavigationProperties.class, KubernetesProperties.class})
@Import(DashboardPluginImportSelector.class)
public class DashboardApplication {

    private static final Logger log = LoggerFactory.getLogger(DashboardApplication.class);

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication();
        application.setSources(applicationSources(Thread.currentThread().getContextClassLoader()));
        application.run(args);
    }

    static Set<String> applicationSources(ClassLoader classLoader) {
        DashboardPlugins plugins = DashboardPlugins.discover(classLoader);
        if (!plugins.names().isEmpty()) {
            log.info("Loaded dashboard plugins: {}", plugins.names());
        }

        Set<String> sources = new LinkedHashSet<>();
        sources.add(DashboardApplication.class.getName());
        sources.addAll(plugins.configurationClassNames());
        return sources;
    }
}
