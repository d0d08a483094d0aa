package io.devdash.dashboard.config;

import io.devdash.common.module.NamespaceChangeListener;
import io.devdash.dashboard.cluster.ClusterInfoProvider;
import io.devdash.dashboard.cluster.CurrentNamespace;
import io.devdash.dashboard.cluster.KubernetesClusterInfoProvider;
import io.devdash.dashboard.cluster.KubernetesNamespaceProvider;
import io.devdash.dashboard.cluster.NamespaceProvider;
import io.devdash.dashboard.registry.ModuleRegistry;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class CoreDefaults {

    static final String DEFAULT_NAMESPACE = "default";

    @Bean
    @ConditionalOnMissingBean(NamespaceProvider.class)
    public NamespaceProvider namespaceProvider(ObjectProvider<KubernetesClient> clientProvider) {
        return new KubernetesNamespaceProvider(clientProvider);
    }

    @Bean
    @ConditionalOnMissingBean(ClusterInfoProvider.class)
    public ClusterInfoProvider clusterInfoProvider(ObjectProvider<KubernetesClient> clientProvider) {
        return new KubernetesClusterInfoProvider(clientProvider);
    }

    @Bean
    @ConditionalOnMissingBean(CurrentNamespace.class)
    public CurrentNamespace currentNamespace(KubernetesProperties properties,
                                             ObjectProvider<KubernetesClient> clientProvider,
                                             ModuleRegistry registry) {
        List<NamespaceChangeListener> listeners = registry.modules().stream()
                .filter(NamespaceChangeListener.class::isInstance)
                .map(NamespaceChangeListener.class::cast)
                .toList();
        return new CurrentNamespace(initialNamespace(properties, clientProvider), listeners);
    }

    static String initialNamespace(KubernetesProperties properties, ObjectProvider<KubernetesClient> clientProvider) {
        if (properties.namespace() != null && !properties.namespace().isBlank()) {
            return properties.namespace();
        }
        KubernetesClient client = clientProvider.getIfAvailable();
        if (client != null && client.getNamespace() != null && !client.getNamespace().isBlank()) {
            return client.getNamespace();
        }
        return DEFAULT_NAMESPACE;
    }
}
