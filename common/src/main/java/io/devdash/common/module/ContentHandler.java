package io.devdash.common.module;

import io.devdash.common.model.ContentResponse;
import reactor.core.publisher.Mono;

@FunctionalInterface
public interface ContentHandler {

    /**
     * Serves a content request. Unknown paths should complete with {@link ContentNotFoundException}.
     */
    Mono<ContentResponse> handle(ContentRequest request);
}
