package io.devdash.dashboard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Locale;

/**
 * HTTP surface settings.
 *
 * @param prefix        mount prefix of every dashboard route
 * @param acceptedHosts host names (port stripped) the API answers for
 */
@ConfigurationProperties(prefix = "devdash.api")
public record ApiProperties(
        String prefix,
        List<String> acceptedHosts
) {
    public static final String DEFAULT_PREFIX = "/api/v1";
    public static final List<String> DEFAULT_ACCEPTED_HOSTS = List.of("localhost", "127.0.0.1");

    public ApiProperties {
        prefix = normalizePrefix(prefix);
        acceptedHosts = acceptedHosts == null || acceptedHosts.isEmpty()
                ? DEFAULT_ACCEPTED_HOSTS
                : acceptedHosts.stream()
                        .filter(host -> host != null && !host.isBlank())
                        .map(host -> host.trim().toLowerCase(Locale.ROOT))
                        .toList();
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return DEFAULT_PREFIX;
        }
        String normalized = prefix.trim();
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
