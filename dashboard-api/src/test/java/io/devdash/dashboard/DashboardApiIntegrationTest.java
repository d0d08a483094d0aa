package io.devdash.dashboard;

import io.devdash.dashboard.cluster.ClusterInfoProvider;
import io.devdash.dashboard.cluster.NamespaceProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.boot.test.autoconfigure.actuate.observability.AutoConfigureObservability;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@AutoConfigureObservability
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "server.address=0.0.0.0",
                "devdash.navigation.failure-policy=SKIP_FAILED"
        })
class DashboardApiIntegrationTest {

    private static final Path LOCAL_CONTENT = localContent();

    @DynamicPropertySource
    static void localContentRoot(DynamicPropertyRegistry registry) {
        registry.add("devdash.local-content.root", LOCAL_CONTENT::toString);
    }

    @LocalServerPort
    private int port;

    private WebTestClient webTestClient;

    @MockitoBean
    private NamespaceProvider namespaceProvider;

    @MockitoBean
    private ClusterInfoProvider clusterInfoProvider;

    @BeforeEach
    void bindToServer() {
        webTestClient = WebTestClient.bindToServer()
                .baseUrl("http://localhost:" + port)
                .build();
    }

    @Test
    void navigationListsPluginModulesInBeanOrder() {
        webTestClient.get()
                .uri("/api/v1/navigation")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sections[0].title").isEqualTo("Overview")
                .jsonPath("$.sections[0].path").isEqualTo("/content/overview")
                .jsonPath("$.sections[1].title").isEqualTo("Test Plugin")
                .jsonPath("$.sections[2].title").isEqualTo("Local Contents")
                .jsonPath("$.sections[2].children[0].title").isEqualTo("Hello")
                .jsonPath("$.sections[2].children[0].path").isEqualTo("/content/local/hello");
    }

    @Test
    void contentIsServedByOwningPlugin() {
        webTestClient.get()
                .uri("/api/v1/content/local/hello")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.title").isEqualTo("Hello")
                .jsonPath("$.views[0].type").isEqualTo("summary");

        webTestClient.get()
                .uri("/api/v1/content/test-plugin/deep/path?namespace=apps")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.views[0].data.path").isEqualTo("deep/path")
                .jsonPath("$.views[0].data.namespace").isEqualTo("apps");
    }

    @Test
    void namespacesComeFromProvider() {
        when(namespaceProvider.list()).thenReturn(List.of("apps", "default"));

        webTestClient.get()
                .uri("/api/v1/namespaces")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.namespaces[0]").isEqualTo("apps");
    }

    @Test
    void unknownRouteReturnsNotFoundEnvelope() {
        webTestClient.get()
                .uri("/does-not-exist")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .json("{\"error\":{\"code\":404,\"message\":\"not found\"}}");
    }

    @Test
    void unknownApiRouteAndWrongMethodUseErrorEnvelope() {
        webTestClient.get()
                .uri("/api/v1/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .json("{\"error\":{\"code\":404,\"message\":\"not found\"}}");

        webTestClient.post()
                .uri("/api/v1/navigation")
                .exchange()
                .expectStatus().isEqualTo(405)
                .expectBody()
                .jsonPath("$.error.code").isEqualTo(405);
    }

    @Test
    void hostMatchIgnoresCaseAndPort() {
        webTestClient.get()
                .uri("/actuator/health")
                .header(HttpHeaders.HOST, "LOCALHOST:1")
                .exchange()
                .expectStatus().isOk();
    }

    @Test
    void reboundHostIsRejectedBeforeRouting() {
        webTestClient.get()
                .uri("/api/v1/content/local/hello")
                .header(HttpHeaders.HOST, "rebound.example")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .json("{\"error\":{\"code\":403,\"message\":\"forbidden\"}}");

        webTestClient.get()
                .uri("/actuator/health")
                .header(HttpHeaders.HOST, "evil.example")
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void prometheusEndpointExposesDashboardCounters() {
        webTestClient.get().uri("/api/v1/navigation").exchange().expectStatus().isOk();

        webTestClient.get()
                .uri("/actuator/prometheus")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .value(body -> assertThat(body)
                        .contains("dashboard_navigation_requests_total"));
    }

    private static Path localContent() {
        try {
            Path root = Files.createTempDirectory("devdash-local-content");
            Files.writeString(root.resolve("hello.json"), """
                    {"title": "Hello", "views": [{"type": "summary", "title": "Greeting", "data": {"text": "hi"}}]}
                    """);
            root.toFile().deleteOnExit();
            root.resolve("hello.json").toFile().deleteOnExit();
            return root;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
