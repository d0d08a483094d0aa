package io.devdash.dashboard.api;

import io.devdash.dashboard.cluster.CurrentNamespace;
import io.devdash.dashboard.cluster.NamespaceProvider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
public class NamespaceController {

    private final NamespaceProvider namespaceProvider;
    private final CurrentNamespace currentNamespace;

    public NamespaceController(NamespaceProvider namespaceProvider, CurrentNamespace currentNamespace) {
        this.namespaceProvider = namespaceProvider;
        this.currentNamespace = currentNamespace;
    }

    @GetMapping(path = "/namespaces", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<NamespacesResponse> namespaces() {
        return Mono.fromCallable(namespaceProvider::list)
                .subscribeOn(Schedulers.boundedElastic())
                .map(NamespacesResponse::new)
                .onErrorMap(ex -> new ClusterAccessException("unable to list namespaces", ex));
    }

    @GetMapping(path = "/namespace", produces = MediaType.APPLICATION_JSON_VALUE)
    public NamespaceResponse read() {
        return new NamespaceResponse(currentNamespace.get());
    }

    @PostMapping(path = "/namespace", produces = MediaType.APPLICATION_JSON_VALUE)
    public NamespaceResponse update(@RequestBody @Valid NamespaceRequest request) {
        currentNamespace.set(request.namespace());
        return new NamespaceResponse(currentNamespace.get());
    }

    // --- DTOs ---

    public record NamespacesResponse(List<String> namespaces) {
    }

    public record NamespaceRequest(@NotBlank(message = "namespace is required") String namespace) {
    }

    public record NamespaceResponse(String namespace) {
    }
}
