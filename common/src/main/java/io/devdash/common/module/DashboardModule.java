package io.devdash.common.module;

import io.devdash.common.model.NavigationSection;
import reactor.core.publisher.Mono;

/**
 * A pluggable unit owning one subtree of dashboard content and its navigation entry.
 */
public interface DashboardModule {

    /**
     * Name used in logs, metrics and navigation failure reports.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Path segment under {@value ContentPaths#CONTENT_ROOT} that this module serves.
     */
    String contentPath();

    /**
     * Builds the navigation section of this module for a namespace.
     *
     * @param namespace   namespace the dashboard is scoped to, empty when unscoped
     * @param contentPath resolved content prefix of this module, e.g. {@code /content/overview}
     */
    Mono<NavigationSection> navigation(String namespace, String contentPath);

    /**
     * Handler serving the content of this module. Called once, when content routes are installed.
     */
    ContentHandler contentHandler();
}
