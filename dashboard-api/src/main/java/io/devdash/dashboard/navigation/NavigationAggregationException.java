package io.devdash.dashboard.navigation;

public class NavigationAggregationException extends RuntimeException {
    private final String module;

    public NavigationAggregationException(String module, Throwable cause) {
        super("Navigation of module " + module + " failed", cause);
        this.module = module;
    }

    public String module() {
        return module;
    }
}
