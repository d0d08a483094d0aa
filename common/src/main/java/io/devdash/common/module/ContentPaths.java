package io.devdash.common.module;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Slash-separated path helpers shared by the registry and by modules building navigation paths.
 */
public final class ContentPaths {

    public static final String CONTENT_ROOT = "/content";

    private ContentPaths() {
    }

    /**
     * Joins segments with {@code /} and cleans the result: empty and {@code .} segments are dropped,
     * {@code ..} removes the previous segment. The result is absolute when the first non-empty
     * segment is, and never ends with a slash unless it is the root.
     */
    public static String join(String... segments) {
        StringBuilder raw = new StringBuilder();
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                continue;
            }
            if (raw.length() > 0) {
                raw.append('/');
            }
            raw.append(segment);
        }
        return clean(raw.toString());
    }

    public static String clean(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        boolean absolute = path.startsWith("/");
        Deque<String> parts = new ArrayDeque<>();
        for (String part : path.split("/")) {
            if (part.isEmpty() || ".".equals(part)) {
                continue;
            }
            if ("..".equals(part)) {
                if (!parts.isEmpty() && !"..".equals(parts.peekLast())) {
                    parts.removeLast();
                } else if (!absolute) {
                    parts.addLast(part);
                }
                continue;
            }
            parts.addLast(part);
        }
        String joined = String.join("/", parts);
        if (absolute) {
            return "/" + joined;
        }
        return joined;
    }

    /**
     * Content prefix of a module: {@value #CONTENT_ROOT} joined with the module's own path.
     */
    public static String contentPrefix(String modulePath) {
        return join(CONTENT_ROOT, modulePath);
    }
}
