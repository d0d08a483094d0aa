package io.devdash.dashboard.cluster;

public record ClusterInfo(
        String context,
        String cluster,
        String server,
        String user
) {
}
