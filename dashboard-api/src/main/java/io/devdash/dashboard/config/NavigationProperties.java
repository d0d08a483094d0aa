package io.devdash.dashboard.config;

import io.devdash.dashboard.navigation.NavigationFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param failurePolicy what a module navigation failure does to the whole navigation request
 * @param concurrency   number of modules queried at once; 1 queries them one after the other
 */
@ConfigurationProperties(prefix = "devdash.navigation")
public record NavigationProperties(
        NavigationFailurePolicy failurePolicy,
        Integer concurrency
) {
    public NavigationProperties {
        failurePolicy = failurePolicy == null ? NavigationFailurePolicy.FAIL_FAST : failurePolicy;
        concurrency = concurrency == null || concurrency < 1 ? 1 : concurrency;
    }

    public static NavigationProperties defaults() {
        return new NavigationProperties(null, null);
    }
}
