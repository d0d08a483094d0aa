package io.devdash.dashboard.config;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.http.HttpClient;
import io.fabric8.kubernetes.client.impl.KubernetesClientImpl;
import io.fabric8.kubernetes.client.vertx.VertxHttpClientFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Builds the cluster client. An explicit kubeconfig file or context wins; otherwise the
 * ServiceAccount mount is used when present, and the default kubeconfig lookup when not.
 */
@Configuration
public class KubernetesClientConfig {

    private static final Logger log = LoggerFactory.getLogger(KubernetesClientConfig.class);
    private static final Path SA_TOKEN = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/token");
    private static final Path SA_CA    = Path.of("/var/run/secrets/kubernetes.io/serviceaccount/ca.crt");

    private final KubernetesProperties properties;
    private final Path tokenPath;
    private final Path caPath;
    private final Function<String, String> env;

    @Autowired
    public KubernetesClientConfig(KubernetesProperties properties) {
        this(properties, SA_TOKEN, SA_CA, System::getenv);
    }

    KubernetesClientConfig(KubernetesProperties properties, Path tokenPath, Path caPath, Function<String, String> env) {
        this.properties = properties == null ? KubernetesProperties.defaults() : properties;
        this.tokenPath = tokenPath;
        this.caPath = caPath;
        this.env = env;
    }

    @Bean(destroyMethod = "close")
    public KubernetesClient kubernetesClient() {
        if (properties.hasKubeconfig() || properties.hasContext()) {
            return kubeconfigClient();
        }
        if (Files.exists(tokenPath)) {
            return inClusterClient();
        }
        return new KubernetesClientBuilder()
                .withHttpClientFactory(new VertxHttpClientFactory())
                .build();
    }

    private KubernetesClient kubeconfigClient() {
        String context = properties.hasContext() ? properties.context() : null;
        Config config;
        if (properties.hasKubeconfig()) {
            Path kubeconfig = Path.of(properties.kubeconfig());
            String contents;
            try {
                contents = Files.readString(kubeconfig);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read kubeconfig " + kubeconfig, e);
            }
            config = Config.fromKubeconfig(context, contents, kubeconfig.toAbsolutePath().toString());
        } else {
            config = Config.autoConfigure(context);
        }
        log.info("Kubeconfig K8s config: masterUrl={}, context={}", config.getMasterUrl(),
                config.getCurrentContext() == null ? null : config.getCurrentContext().getName());

        return new KubernetesClientBuilder()
                .withConfig(config)
                .withHttpClientFactory(new VertxHttpClientFactory())
                .build();
    }

    private KubernetesClient inClusterClient() {
        String host = env.apply("KUBERNETES_SERVICE_HOST");
        String port = env.apply("KUBERNETES_SERVICE_PORT");
        if (host == null || host.isBlank() || port == null || port.isBlank()) {
            throw new IllegalStateException("Missing Kubernetes service host/port for in-cluster configuration");
        }

        String token;
        try {
            token = Files.readString(tokenPath).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read in-cluster ServiceAccount credentials", e);
        }
        if (token.isEmpty()) {
            throw new IllegalStateException("ServiceAccount token is empty: " + tokenPath);
        }

        String caCert = caPath.toAbsolutePath().toString();
        String masterUrl = "https://" + host + ":" + port;
        log.info("In-cluster K8s config: masterUrl={}, caCert={}", masterUrl, caCert);

        Config config = new ConfigBuilder()
                .withMasterUrl(masterUrl)
                .withOauthToken(token)
                .withCaCertFile(caCert)
                .build();

        // KubernetesClientBuilder would re-run auto configuration over this config
        HttpClient httpClient = new VertxHttpClientFactory().newBuilder(config).build();
        return new KubernetesClientImpl(httpClient, config);
    }
}
