package io.devdash.dashboard.security;

import java.util.Locale;
import java.util.Optional;

/**
 * Extracts the host name from a raw {@code Host} header value.
 */
final class HostHeader {

    private HostHeader() {
    }

    /**
     * Returns the lower-cased host name with the port stripped, or empty when the value is missing or
     * malformed. Bracketed IPv6 literals are returned without brackets: {@code [::1]:7777 -> ::1}.
     */
    static Optional<String> hostname(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        String host;
        String port;
        if (value.startsWith("[")) {
            int end = value.indexOf(']');
            if (end < 0) {
                return Optional.empty();
            }
            host = value.substring(1, end);
            String rest = value.substring(end + 1);
            if (rest.isEmpty()) {
                port = null;
            } else if (rest.startsWith(":")) {
                port = rest.substring(1);
            } else {
                return Optional.empty();
            }
        } else {
            int colon = value.indexOf(':');
            if (colon != value.lastIndexOf(':')) {
                // unbracketed IPv6 literal
                return Optional.empty();
            }
            host = colon < 0 ? value : value.substring(0, colon);
            port = colon < 0 ? null : value.substring(colon + 1);
        }

        if (host.isEmpty() || (port != null && !isPort(port))) {
            return Optional.empty();
        }
        return Optional.of(host.toLowerCase(Locale.ROOT));
    }

    private static boolean isPort(String port) {
        if (port.isEmpty() || port.length() > 5) {
            return false;
        }
        for (int i = 0; i < port.length(); i++) {
            if (!Character.isDigit(port.charAt(i))) {
                return false;
            }
        }
        return Integer.parseInt(port) <= 65535;
    }
}
