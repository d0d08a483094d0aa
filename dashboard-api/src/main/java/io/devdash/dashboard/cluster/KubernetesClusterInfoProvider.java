package io.devdash.dashboard.cluster;

import io.fabric8.kubernetes.api.model.Context;
import io.fabric8.kubernetes.api.model.NamedContext;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Reads cluster identity from the client configuration (kubeconfig current context or in-cluster config).
 */
public class KubernetesClusterInfoProvider implements ClusterInfoProvider {

    private final ObjectProvider<KubernetesClient> clientProvider;

    public KubernetesClusterInfoProvider(ObjectProvider<KubernetesClient> clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public ClusterInfo get() {
        KubernetesClient client = clientProvider.getObject();
        Config config = client.getConfiguration();
        String server = client.getMasterUrl() == null ? config.getMasterUrl() : client.getMasterUrl().toString();

        NamedContext current = config.getCurrentContext();
        if (current == null) {
            return new ClusterInfo("", "", server, "");
        }
        Context context = current.getContext();
        return new ClusterInfo(
                nullToEmpty(current.getName()),
                context == null ? "" : nullToEmpty(context.getCluster()),
                server,
                context == null ? "" : nullToEmpty(context.getUser()));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
