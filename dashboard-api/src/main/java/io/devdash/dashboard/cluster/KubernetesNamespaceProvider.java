package io.devdash.dashboard.cluster;

import io.fabric8.kubernetes.api.model.Namespace;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

public class KubernetesNamespaceProvider implements NamespaceProvider {

    private final ObjectProvider<KubernetesClient> clientProvider;

    public KubernetesNamespaceProvider(ObjectProvider<KubernetesClient> clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public List<String> list() {
        List<Namespace> items = clientProvider.getObject().namespaces().list().getItems();
        return items.stream()
                .map(namespace -> namespace.getMetadata().getName())
                .sorted()
                .toList();
    }
}
