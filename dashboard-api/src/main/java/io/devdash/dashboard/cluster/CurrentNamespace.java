package io.devdash.dashboard.cluster;

import io.devdash.common.module.NamespaceChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The namespace the dashboard is currently showing. Listeners are notified in registration order.
 */
public class CurrentNamespace {
    private static final Logger log = LoggerFactory.getLogger(CurrentNamespace.class);

    private final AtomicReference<String> namespace;
    private final List<NamespaceChangeListener> listeners;

    public CurrentNamespace(String initial, List<NamespaceChangeListener> listeners) {
        this.namespace = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    public String get() {
        return namespace.get();
    }

    public void set(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        String previous = namespace.getAndSet(value);
        if (value.equals(previous)) {
            return;
        }
        log.info("Current namespace changed from {} to {}", previous, value);
        for (NamespaceChangeListener listener : listeners) {
            try {
                listener.onNamespaceChange(value);
            } catch (RuntimeException e) {
                log.error("Namespace change listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }
}
