package io.devdash.dashboard.cluster;

import java.util.List;

@FunctionalInterface
public interface NamespaceProvider {
    /**
     * Names of the namespaces visible to the dashboard. May block.
     */
    List<String> list();
}
