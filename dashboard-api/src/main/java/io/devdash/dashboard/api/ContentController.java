package io.devdash.dashboard.api;

import io.devdash.common.model.ContentResponse;
import io.devdash.common.module.ContentPaths;
import io.devdash.dashboard.cluster.CurrentNamespace;
import io.devdash.dashboard.content.ContentRouter;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class ContentController {

    static final String NAMESPACE_PARAM = "namespace";

    private final ContentRouter router;
    private final CurrentNamespace currentNamespace;

    public ContentController(ContentRouter router, CurrentNamespace currentNamespace) {
        this.router = router;
        this.currentNamespace = currentNamespace;
    }

    @RequestMapping(path = ContentPaths.CONTENT_ROOT + "/{*path}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ContentResponse> content(@PathVariable String path, ServerHttpRequest request) {
        String namespace = request.getQueryParams().getFirst(NAMESPACE_PARAM);
        if (namespace == null || namespace.isBlank()) {
            namespace = currentNamespace.get();
        }
        return router.route(
                ContentPaths.join(ContentPaths.CONTENT_ROOT, path),
                namespace,
                request.getMethod().name(),
                request.getQueryParams());
    }
}
