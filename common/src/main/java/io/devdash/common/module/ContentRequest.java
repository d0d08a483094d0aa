package io.devdash.common.module;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A content request delegated to a module.
 *
 * @param path        path below the module prefix, without a leading slash; empty for the module root
 * @param namespace   namespace the request is scoped to
 * @param method      HTTP method name
 * @param queryParams query parameters of the inbound request
 */
public record ContentRequest(
        String path,
        String namespace,
        String method,
        Map<String, List<String>> queryParams
) {
    public ContentRequest {
        Objects.requireNonNull(path, "path");
        namespace = namespace == null ? "" : namespace;
        method = method == null ? "GET" : method;
        queryParams = queryParams == null ? Map.of() : Map.copyOf(queryParams);
    }

    public ContentRequest(String path, String namespace) {
        this(path, namespace, "GET", Map.of());
    }
}
