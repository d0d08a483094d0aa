package io.devdash.dashboard.api;

import io.devdash.dashboard.navigation.NavigationAggregator;
import io.devdash.dashboard.navigation.NavigationResult;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
public class NavigationController {

    private final NavigationAggregator aggregator;

    public NavigationController(NavigationAggregator aggregator) {
        this.aggregator = aggregator;
    }

    @GetMapping(path = "/navigation", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<NavigationResult> navigation() {
        return aggregator.sections("");
    }

    @GetMapping(path = "/navigation/namespace/{namespace}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<NavigationResult> namespacedNavigation(@PathVariable String namespace) {
        return aggregator.sections(namespace);
    }
}
