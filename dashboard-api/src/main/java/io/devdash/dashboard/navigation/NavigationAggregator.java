package io.devdash.dashboard.navigation;

import io.devdash.common.model.NavigationSection;
import io.devdash.dashboard.config.NavigationProperties;
import io.devdash.dashboard.registry.ModuleRegistry;
import io.devdash.dashboard.service.DashboardMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Composes the navigation tree by asking every registered module, in registration order, for its
 * section. The registration order is the top-level order of the tree.
 */
@Service
public class NavigationAggregator {
    private static final Logger log = LoggerFactory.getLogger(NavigationAggregator.class);

    private final ModuleRegistry registry;
    private final NavigationProperties properties;
    private final DashboardMetrics metrics;

    public NavigationAggregator(ModuleRegistry registry, NavigationProperties properties, DashboardMetrics metrics) {
        this.registry = registry;
        this.properties = properties;
        this.metrics = metrics;
    }

    public Mono<NavigationResult> sections(String namespace) {
        String scope = namespace == null ? "" : namespace;
        metrics.navigationRequest();

        Flux<ModuleRegistry.Entry> entries = Flux.fromIterable(registry.entries());
        Flux<NavigationOutcome> outcomes = properties.concurrency() <= 1
                ? entries.concatMap(entry -> navigate(entry, scope))
                : entries.flatMapSequential(entry -> navigate(entry, scope), properties.concurrency());

        return outcomes.collectList().map(NavigationAggregator::assemble);
    }

    private Mono<NavigationOutcome> navigate(ModuleRegistry.Entry entry, String namespace) {
        String name = entry.name();
        Mono<NavigationOutcome> outcome = Mono.defer(() -> entry.module().navigation(namespace, entry.contentPath()))
                .map(section -> NavigationOutcome.success(name, section))
                .defaultIfEmpty(NavigationOutcome.empty(name))
                .doOnError(ex -> metrics.navigationFailure(name));

        if (properties.failurePolicy() == NavigationFailurePolicy.SKIP_FAILED) {
            return outcome.onErrorResume(ex -> {
                log.warn("Skipping navigation of module {} for namespace '{}': {}", name, namespace, ex.toString());
                return Mono.just(NavigationOutcome.failure(name, ex));
            });
        }
        return outcome.onErrorMap(ex -> new NavigationAggregationException(name, ex));
    }

    private static NavigationResult assemble(List<NavigationOutcome> outcomes) {
        List<NavigationSection> sections = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (NavigationOutcome outcome : outcomes) {
            if (outcome.failed()) {
                failed.add(outcome.module());
            } else if (outcome.section() != null) {
                sections.add(outcome.section());
            }
        }
        return new NavigationResult(sections, failed);
    }
}
