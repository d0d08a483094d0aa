package io.devdash.dashboard.content;

import io.devdash.common.model.ContentResponse;
import io.devdash.common.module.ContentHandler;
import io.devdash.common.module.ContentNotFoundException;
import io.devdash.common.module.ContentRequest;
import io.devdash.dashboard.registry.ModuleRegistry;
import io.devdash.dashboard.service.DashboardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dispatches content requests to the module owning the longest matching content prefix.
 * One route per module is installed at construction; a module whose route cannot be installed
 * is logged and left unreachable while the others keep serving.
 */
@Component
public class ContentRouter {
    private static final Logger log = LoggerFactory.getLogger(ContentRouter.class);

    private final ModuleRegistry registry;
    private final DashboardMetrics metrics;
    private final Map<String, ContentHandler> routes;

    public ContentRouter(ModuleRegistry registry, DashboardMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
        this.routes = Collections.unmodifiableMap(installRoutes(registry));
    }

    private static Map<String, ContentHandler> installRoutes(ModuleRegistry registry) {
        Map<String, ContentHandler> installed = new LinkedHashMap<>();
        for (ModuleRegistry.Entry entry : registry.entries()) {
            try {
                ContentHandler handler = entry.module().contentHandler();
                if (handler == null) {
                    log.error("Unable to install content route {}: module {} has no content handler",
                            entry.contentPath(), entry.name());
                    continue;
                }
                installed.put(entry.contentPath(), handler);
                log.debug("Installed content route {} for module {}", entry.contentPath(), entry.name());
            } catch (RuntimeException e) {
                log.error("Unable to install content route {} for module {}", entry.contentPath(), entry.name(), e);
            }
        }
        return installed;
    }

    /**
     * Content prefixes that currently have a route.
     */
    public List<String> routedPaths() {
        return List.copyOf(routes.keySet());
    }

    /**
     * @param path        request path relative to the API prefix, e.g. {@code /content/overview/workloads}
     * @param namespace   namespace the request is scoped to
     * @param method      HTTP method name
     * @param queryParams query parameters of the request
     */
    public Mono<ContentResponse> route(String path, String namespace, String method,
                                       Map<String, List<String>> queryParams) {
        return Mono.defer(() -> {
            ModuleRegistry.Match match = registry.resolve(path).orElse(null);
            ContentHandler handler = match == null ? null : routes.get(match.entry().contentPath());
            if (handler == null) {
                log.debug("No content route for {}", path);
                metrics.routeMiss();
                return Mono.error(new ContentNotFoundException(path));
            }

            String module = match.entry().name();
            metrics.contentRequest(module);
            ContentRequest request = new ContentRequest(match.suffix(), namespace, method, queryParams);
            return handler.handle(request)
                    .switchIfEmpty(Mono.error(() -> new ContentNotFoundException(path)));
        });
    }
}
