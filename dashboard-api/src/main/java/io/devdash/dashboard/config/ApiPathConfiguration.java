package io.devdash.dashboard.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.HandlerTypePredicate;
import org.springframework.web.reactive.config.PathMatchConfigurer;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Mounts every dashboard controller under the configured API prefix.
 */
@Configuration(proxyBeanMethods = false)
public class ApiPathConfiguration implements WebFluxConfigurer {

    private final ApiProperties properties;

    public ApiPathConfiguration(ApiProperties properties) {
        this.properties = properties;
    }

    @Override
    public void configurePathMatching(PathMatchConfigurer configurer) {
        configurer.addPathPrefix(properties.prefix(), HandlerTypePredicate.forAnnotation(RestController.class));
    }
}
