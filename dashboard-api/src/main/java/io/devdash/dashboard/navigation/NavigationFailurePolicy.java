package io.devdash.dashboard.navigation;

public enum NavigationFailurePolicy {
    /**
     * The first failing module fails the whole navigation request; partial results are discarded.
     */
    FAIL_FAST,
    /**
     * Failing modules are left out of the tree and reported by name.
     */
    SKIP_FAILED
}
