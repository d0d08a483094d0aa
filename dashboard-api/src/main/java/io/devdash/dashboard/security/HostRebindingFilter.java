package io.devdash.dashboard.security;

import io.devdash.dashboard.api.ErrorResponses;
import io.devdash.dashboard.config.ApiProperties;
import io.devdash.dashboard.service.DashboardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.Set;

/**
 * Rejects requests whose {@code Host} header is not an accepted local name, before any routing.
 * The dashboard listens on loopback; a page on another origin that rebinds its DNS name to
 * 127.0.0.1 still sends its own name in {@code Host}.
 */
@Component
public class HostRebindingFilter implements WebFilter, Ordered {
    private static final Logger log = LoggerFactory.getLogger(HostRebindingFilter.class);

    private final Set<String> acceptedHosts;
    private final ErrorResponses errors;
    private final DashboardMetrics metrics;

    public HostRebindingFilter(ApiProperties properties, ErrorResponses errors, DashboardMetrics metrics) {
        this.acceptedHosts = Set.copyOf(properties.acceptedHosts());
        this.errors = errors;
        this.metrics = metrics;
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String raw = exchange.getRequest().getHeaders().getFirst(HttpHeaders.HOST);
        Optional<String> host = HostHeader.hostname(raw);
        if (host.isEmpty()) {
            log.warn("Rejected request to {} with malformed Host header '{}'", exchange.getRequest().getPath(), raw);
            metrics.hostRejected("malformed");
            return errors.write(exchange, HttpStatus.BAD_REQUEST, "bad request");
        }
        if (!acceptedHosts.contains(host.get())) {
            log.warn("Rejected request to {} for host '{}'", exchange.getRequest().getPath(), host.get());
            metrics.hostRejected("not_accepted");
            return errors.write(exchange, HttpStatus.FORBIDDEN, "forbidden");
        }
        return chain.filter(exchange);
    }
}
