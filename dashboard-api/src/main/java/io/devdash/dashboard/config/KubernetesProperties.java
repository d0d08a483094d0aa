package io.devdash.dashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param namespace  initial current namespace; falls back to the client's namespace
 * @param kubeconfig kubeconfig file to read instead of the default lookup
 * @param context    kubeconfig context to use instead of the current one
 */
@ConfigurationProperties(prefix = "devdash.k8s")
public record KubernetesProperties(
        String namespace,
        String kubeconfig,
        String context
) {
    public static KubernetesProperties defaults() {
        return new KubernetesProperties(null, null, null);
    }

    boolean hasKubeconfig() {
        return kubeconfig != null && !kubeconfig.isBlank();
    }

    boolean hasContext() {
        return context != null && !context.isBlank();
    }
}
