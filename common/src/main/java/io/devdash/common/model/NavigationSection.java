package io.devdash.common.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One node of the navigation tree shown to the client.
 *
 * @param id       stable identity derived from the path, so clients can diff re-renders
 * @param title    display label
 * @param path     resolved path of the node
 * @param children ordered child sections
 */
public record NavigationSection(
        String id,
        String title,
        String path,
        List<NavigationSection> children
) {
    public NavigationSection {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(path, "path");
        id = id == null ? stableId(path) : id;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static NavigationSection of(String title, String path, NavigationSection... children) {
        return of(title, path, Arrays.asList(children));
    }

    public static NavigationSection of(String title, String path, List<NavigationSection> children) {
        return new NavigationSection(null, title, path, children);
    }

    static String stableId(String path) {
        return UUID.nameUUIDFromBytes(path.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
