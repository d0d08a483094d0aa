package io.devdash.dashboard.api;

import io.devdash.dashboard.cluster.ClusterInfo;
import io.devdash.dashboard.cluster.ClusterInfoProvider;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class ClusterInfoController {

    private final ClusterInfoProvider clusterInfoProvider;

    public ClusterInfoController(ClusterInfoProvider clusterInfoProvider) {
        this.clusterInfoProvider = clusterInfoProvider;
    }

    @RequestMapping(path = "/cluster-info", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ClusterInfo> clusterInfo() {
        return Mono.fromCallable(clusterInfoProvider::get)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(ex -> new ClusterAccessException("unable to retrieve cluster info", ex));
    }
}
