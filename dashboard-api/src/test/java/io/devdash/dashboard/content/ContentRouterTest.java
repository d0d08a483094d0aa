package io.devdash.dashboard.content;

import io.devdash.common.model.ContentResponse;
import io.devdash.common.module.ContentNotFoundException;
import io.devdash.common.module.ContentRequest;
import io.devdash.dashboard.registry.ModuleRegistry;
import io.devdash.dashboard.service.DashboardMetrics;
import io.devdash.dashboard.support.StubModule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentRouterTest {

    private SimpleMeterRegistry meterRegistry;
    private DashboardMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new DashboardMetrics(meterRegistry);
    }

    @Test
    void routesSuffixAndNamespaceToOwningModule() {
        StubModule overview = StubModule.named("overview");
        StubModule other = StubModule.named("other");
        ContentRouter router = new ContentRouter(registry(overview, other), metrics);

        ContentResponse response = router.route("/content/overview/x/y", "team", "GET",
                Map.of("filter", List.of("app=web"))).block();

        assertThat(response.title()).isEqualTo("overview");
        assertThat(overview.requests()).hasSize(1);
        ContentRequest request = overview.requests().get(0);
        assertThat(request.path()).isEqualTo("x/y");
        assertThat(request.namespace()).isEqualTo("team");
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.queryParams()).containsEntry("filter", List.of("app=web"));
        assertThat(other.requests()).isEmpty();
        assertThat(meterRegistry.counter("dashboard_content_requests_total", "module", "overview").count())
                .isEqualTo(1.0);
    }

    @Test
    void nestedPrefixWinsOverOuterModule() {
        StubModule outer = StubModule.named("a");
        StubModule nested = StubModule.at("nested", "a/b");
        ContentRouter router = new ContentRouter(registry(outer, nested), metrics);

        router.route("/content/a/b/c", "", "GET", Map.of()).block();

        assertThat(nested.requests()).extracting(ContentRequest::path).containsExactly("c");
        assertThat(outer.requests()).isEmpty();
    }

    @Test
    void moduleWithoutHandlerIsUnreachableWhileOthersServe() {
        StubModule failing = StubModule.named("failing").withHandlerSupplier(() -> {
            throw new IllegalStateException("cannot build handler");
        });
        StubModule missing = StubModule.named("missing").withHandlerSupplier(() -> null);
        StubModule healthy = StubModule.named("healthy");

        ContentRouter router = new ContentRouter(registry(failing, missing, healthy), metrics);

        assertThat(router.routedPaths()).containsExactly("/content/healthy");
        assertThatThrownBy(() -> router.route("/content/failing/x", "", "GET", Map.of()).block())
                .isInstanceOf(ContentNotFoundException.class);
        assertThatThrownBy(() -> router.route("/content/missing", "", "GET", Map.of()).block())
                .isInstanceOf(ContentNotFoundException.class);
        assertThat(router.route("/content/healthy/x", "", "GET", Map.of()).block().title()).isEqualTo("healthy");
    }

    @Test
    void unknownPathIsNotFound() {
        ContentRouter router = new ContentRouter(registry(StubModule.named("overview")), metrics);

        assertThatThrownBy(() -> router.route("/content/nope/x", "", "GET", Map.of()).block())
                .isInstanceOf(ContentNotFoundException.class)
                .hasMessageContaining("/content/nope/x");
        assertThat(meterRegistry.counter("dashboard_content_route_miss_total").count()).isEqualTo(1.0);
    }

    @Test
    void emptyHandlerResultIsNotFound() {
        StubModule empty = StubModule.named("empty").withHandler(request -> Mono.empty());
        ContentRouter router = new ContentRouter(registry(empty), metrics);

        assertThatThrownBy(() -> router.route("/content/empty", "", "GET", Map.of()).block())
                .isInstanceOf(ContentNotFoundException.class);
    }

    @Test
    void handlerErrorsPropagate() {
        StubModule broken = StubModule.named("broken")
                .withHandler(request -> Mono.error(new IllegalStateException("down")));
        ContentRouter router = new ContentRouter(registry(broken), metrics);

        assertThatThrownBy(() -> router.route("/content/broken/x", "", "GET", Map.of()).block())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("down");
    }

    private static ModuleRegistry registry(StubModule... modules) {
        ModuleRegistry.Builder builder = ModuleRegistry.builder();
        for (StubModule module : modules) {
            builder.register(module);
        }
        return builder.build();
    }
}
