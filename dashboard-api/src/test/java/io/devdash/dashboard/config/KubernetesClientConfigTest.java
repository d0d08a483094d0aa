package io.devdash.dashboard.config;

import io.fabric8.kubernetes.client.KubernetesClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KubernetesClientConfigTest {

    private static final String KUBECONFIG = """
            apiVersion: v1
            kind: Config
            clusters:
            - name: dev
              cluster:
                server: https://dev.example:6443
            - name: prod
              cluster:
                server: https://prod.example:6443
            contexts:
            - name: dev
              context:
                cluster: dev
                user: admin
                namespace: dev-apps
            - name: prod
              context:
                cluster: prod
                user: admin
                namespace: prod-apps
            current-context: dev
            users:
            - name: admin
              user:
                token: kube-token
            """;

    @TempDir
    Path tempDir;

    @Test
    void springContext_instantiatesConfigurationAndBindsProperties() throws IOException {
        Path kubeconfig = tempDir.resolve("config");
        Files.writeString(kubeconfig, KUBECONFIG);

        new ApplicationContextRunner()
                .withUserConfiguration(KubernetesPropertiesConfiguration.class, KubernetesClientConfig.class)
                .withPropertyValues("devdash.k8s.kubeconfig=" + kubeconfig, "devdash.k8s.context=prod")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    KubernetesClient client = context.getBean(KubernetesClient.class);
                    assertThat(client.getMasterUrl().toString()).startsWith("https://prod.example:6443");
                    assertThat(client.getNamespace()).isEqualTo("prod-apps");
                });
    }

    @Test
    void kubernetesClient_withoutServiceAccountToken_buildsClient() {
        KubernetesClientConfig config = new KubernetesClientConfig(
                KubernetesProperties.defaults(),
                tempDir.resolve("missing-token"),
                tempDir.resolve("ca.crt"),
                key -> null
        );

        try (KubernetesClient client = config.kubernetesClient()) {
            assertThat(client).isNotNull();
        }
    }

    @Test
    void kubernetesClient_withKubeconfigFile_usesCurrentContext() throws IOException {
        Path kubeconfig = tempDir.resolve("config");
        Files.writeString(kubeconfig, KUBECONFIG);

        KubernetesClientConfig config = new KubernetesClientConfig(
                new KubernetesProperties(null, kubeconfig.toString(), null),
                tempDir.resolve("missing-token"), tempDir.resolve("ca.crt"), key -> null);

        try (KubernetesClient client = config.kubernetesClient()) {
            assertThat(client.getMasterUrl().toString()).startsWith("https://dev.example:6443");
            assertThat(client.getNamespace()).isEqualTo("dev-apps");
        }
    }

    @Test
    void kubernetesClient_withContext_switchesCluster() throws IOException {
        Path kubeconfig = tempDir.resolve("config");
        Files.writeString(kubeconfig, KUBECONFIG);

        KubernetesClientConfig config = new KubernetesClientConfig(
                new KubernetesProperties(null, kubeconfig.toString(), "prod"),
                tempDir.resolve("missing-token"), tempDir.resolve("ca.crt"), key -> null);

        try (KubernetesClient client = config.kubernetesClient()) {
            assertThat(client.getMasterUrl().toString()).startsWith("https://prod.example:6443");
            assertThat(client.getNamespace()).isEqualTo("prod-apps");
        }
    }

    @Test
    void kubernetesClient_withMissingKubeconfig_throwsIllegalStateException() {
        KubernetesClientConfig config = new KubernetesClientConfig(
                new KubernetesProperties(null, tempDir.resolve("absent").toString(), null),
                tempDir.resolve("missing-token"), tempDir.resolve("ca.crt"), key -> null);

        assertThatThrownBy(config::kubernetesClient)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to read kubeconfig");
    }

    @Test
    void kubernetesClient_withInClusterCredentials_buildsConfiguredClient() throws IOException {
        Path tokenPath = tempDir.resolve("token");
        Path caPath = tempDir.resolve("ca.crt");
        Files.writeString(tokenPath, "token-123\n");
        Files.writeString(caPath, "-----BEGIN CERTIFICATE-----\nmock\n-----END CERTIFICATE-----\n");

        Map<String, String> env = Map.of(
                "KUBERNETES_SERVICE_HOST", "10.1.2.3",
                "KUBERNETES_SERVICE_PORT", "6443"
        );

        KubernetesClientConfig config = new KubernetesClientConfig(KubernetesProperties.defaults(), tokenPath, caPath, env::get);

        try (KubernetesClient client = config.kubernetesClient()) {
            assertThat(client.getMasterUrl().toString()).startsWith("https://10.1.2.3:6443");
            assertThat(client.getConfiguration().getOauthToken()).isEqualTo("token-123");
            assertThat(client.getConfiguration().getCaCertFile()).isEqualTo(caPath.toAbsolutePath().toString());
        }
    }

    @Test
    void kubernetesClient_inClusterWithoutHostOrPort_throwsIllegalStateException() throws IOException {
        Path tokenPath = tempDir.resolve("token");
        Files.writeString(tokenPath, "token-123");

        KubernetesClientConfig config = new KubernetesClientConfig(
                KubernetesProperties.defaults(), tokenPath, tempDir.resolve("ca.crt"), key -> null);

        assertThatThrownBy(config::kubernetesClient)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Missing Kubernetes service host/port");
    }

    @Test
    void kubernetesClient_inClusterWithEmptyToken_throwsIllegalStateException() throws IOException {
        Path tokenPath = tempDir.resolve("token");
        Files.writeString(tokenPath, "  \n");

        Map<String, String> env = Map.of("KUBERNETES_SERVICE_HOST", "10.1.2.3", "KUBERNETES_SERVICE_PORT", "6443");
        KubernetesClientConfig config = new KubernetesClientConfig(
                KubernetesProperties.defaults(), tokenPath, tempDir.resolve("ca.crt"), env::get);

        assertThatThrownBy(config::kubernetesClient)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ServiceAccount token is empty");
    }

    @EnableConfigurationProperties(KubernetesProperties.class)
    static class KubernetesPropertiesConfiguration {
    }
}
