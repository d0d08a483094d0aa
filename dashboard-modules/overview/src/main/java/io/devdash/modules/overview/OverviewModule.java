package io.devdash.modules.overview;

import io.devdash.common.model.ContentResponse;
import io.devdash.common.model.ContentView;
import io.devdash.common.model.NavigationSection;
import io.devdash.common.module.ContentHandler;
import io.devdash.common.module.ContentNotFoundException;
import io.devdash.common.module.ContentPaths;
import io.devdash.common.module.ContentRequest;
import io.devdash.common.module.DashboardModule;
import io.devdash.common.module.NamespaceChangeListener;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the workloads, services and configuration of a namespace.
 */
public class OverviewModule implements DashboardModule, NamespaceChangeListener {
    private static final Logger log = LoggerFactory.getLogger(OverviewModule.class);

    static final String CONTENT_PATH = "overview";
    static final String DEFAULT_NAMESPACE = "default";

    private final ObjectProvider<KubernetesClient> clientProvider;
    private volatile String namespace = DEFAULT_NAMESPACE;

    public OverviewModule(ObjectProvider<KubernetesClient> clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public String name() {
        return CONTENT_PATH;
    }

    @Override
    public String contentPath() {
        return CONTENT_PATH;
    }

    @Override
    public Mono<NavigationSection> navigation(String namespace, String contentPath) {
        Map<OverviewResource.Group, List<NavigationSection>> groups = new LinkedHashMap<>();
        for (OverviewResource resource : OverviewResource.values()) {
            groups.computeIfAbsent(resource.group, g -> new ArrayList<>())
                    .add(NavigationSection.of(resource.title, ContentPaths.join(contentPath, resource.relativePath())));
        }

        List<NavigationSection> children = new ArrayList<>();
        groups.forEach((group, sections) ->
                children.add(NavigationSection.of(group.title, ContentPaths.join(contentPath, group.path), sections)));
        return Mono.just(NavigationSection.of("Overview", contentPath, children));
    }

    @Override
    public ContentHandler contentHandler() {
        return request -> Mono.fromCallable(() -> render(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public void onNamespaceChange(String namespace) {
        log.debug("Overview default namespace is now {}", namespace);
        this.namespace = namespace;
    }

    ContentResponse render(ContentRequest request) {
        String ns = request.namespace().isBlank() ? namespace : request.namespace();
        String path = ContentPaths.clean(request.path());
        KubernetesClient client = clientProvider.getObject();

        if (path.isEmpty()) {
            return summary(client, ns);
        }
        List<ContentView> views = new ArrayList<>();
        for (OverviewResource resource : OverviewResource.values()) {
            if (path.equals(resource.relativePath()) || path.equals(resource.group.path)) {
                views.add(table(client, ns, resource));
            }
        }
        if (views.isEmpty()) {
            throw new ContentNotFoundException(request.path());
        }
        String title = views.size() == 1 ? views.get(0).title() : groupTitle(path);
        return new ContentResponse(title, views);
    }

    private ContentResponse summary(KubernetesClient client, String ns) {
        Map<String, Object> counts = new LinkedHashMap<>();
        for (OverviewResource resource : OverviewResource.values()) {
            counts.put(resource.title, resource.list(client, ns).size());
        }
        return ContentResponse.of("Overview", ContentView.summary("Namespace " + ns, counts));
    }

    private static ContentView table(KubernetesClient client, String ns, OverviewResource resource) {
        List<String> columns = new ArrayList<>();
        columns.add("Name");
        columns.addAll(resource.extraColumns);
        columns.add("Created");

        List<Map<String, Object>> rows = new ArrayList<>();
        for (HasMetadata item : resource.list(client, ns)) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("Name", item.getMetadata().getName());
            row.putAll(resource.columns(item));
            row.put("Created", item.getMetadata().getCreationTimestamp());
            rows.add(row);
        }
        return ContentView.table(resource.title, columns, rows);
    }

    private static String groupTitle(String path) {
        for (OverviewResource.Group group : OverviewResource.Group.values()) {
            if (group.path.equals(path)) {
                return group.title;
            }
        }
        return path;
    }
}
