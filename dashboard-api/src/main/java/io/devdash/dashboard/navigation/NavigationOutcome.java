package io.devdash.dashboard.navigation;

import io.devdash.common.model.NavigationSection;

/**
 * Result of asking one module for its navigation section: a section (possibly absent when the
 * module has nothing to show) or the failure cause.
 */
public record NavigationOutcome(
        String module,
        NavigationSection section,
        Throwable failure
) {
    public static NavigationOutcome success(String module, NavigationSection section) {
        return new NavigationOutcome(module, section, null);
    }

    public static NavigationOutcome empty(String module) {
        return new NavigationOutcome(module, null, null);
    }

    public static NavigationOutcome failure(String module, Throwable failure) {
        return new NavigationOutcome(module, null, failure);
    }

    public boolean failed() {
        return failure != null;
    }
}
