package io.devdash.dashboard.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class DashboardMetrics {
    private final MeterRegistry registry;
    private final Counter navigationRequests;
    private final Counter routeMisses;
    private final Map<String, Counter> navigationFailureCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> contentCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> hostRejectedCounters = new ConcurrentHashMap<>();

    public DashboardMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.navigationRequests = Counter.builder("dashboard_navigation_requests_total").register(registry);
        this.routeMisses = Counter.builder("dashboard_content_route_miss_total").register(registry);
    }

    public void navigationRequest() {
        navigationRequests.increment();
    }

    public void navigationFailure(String module) {
        counter(navigationFailureCounters, "dashboard_navigation_failure_total", "module", module).increment();
    }

    public void contentRequest(String module) {
        counter(contentCounters, "dashboard_content_requests_total", "module", module).increment();
    }

    public void routeMiss() {
        routeMisses.increment();
    }

    public void hostRejected(String reason) {
        counter(hostRejectedCounters, "dashboard_host_rejected_total", "reason", reason).increment();
    }

    private Counter counter(Map<String, Counter> counters, String name, String tag, String value) {
        return counters.computeIfAbsent(value, v -> Counter.builder(name)
                .tag(tag, v)
                .register(registry));
    }
}
