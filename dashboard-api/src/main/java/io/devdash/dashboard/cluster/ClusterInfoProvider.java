package io.devdash.dashboard.cluster;

@FunctionalInterface
public interface ClusterInfoProvider {
    /**
     * Describes the cluster the dashboard is connected to. May block.
     */
    ClusterInfo get();
}
