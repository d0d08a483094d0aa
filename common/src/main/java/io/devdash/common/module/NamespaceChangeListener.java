package io.devdash.common.module;

/**
 * Implemented by modules that react to the dashboard's current namespace changing.
 */
@FunctionalInterface
public interface NamespaceChangeListener {
    void onNamespaceChange(String namespace);
}
