package io.devdash.modules.overview;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resource kinds listed by the overview, in navigation order.
 */
enum OverviewResource {
    DEPLOYMENTS(Group.WORKLOADS, "deployments", "Deployments", List.of("Ready")) {
        @Override
        List<? extends HasMetadata> list(KubernetesClient client, String namespace) {
            return client.apps().deployments().inNamespace(namespace).list().getItems();
        }

        @Override
        Map<String, Object> columns(HasMetadata item) {
            Deployment deployment = (Deployment) item;
            int desired = deployment.getSpec() == null || deployment.getSpec().getReplicas() == null
                    ? 0 : deployment.getSpec().getReplicas();
            int ready = deployment.getStatus() == null || deployment.getStatus().getReadyReplicas() == null
                    ? 0 : deployment.getStatus().getReadyReplicas();
            return Map.of("Ready", ready + "/" + desired);
        }
    },
    PODS(Group.WORKLOADS, "pods", "Pods", List.of("Phase", "Node")) {
        @Override
        List<? extends HasMetadata> list(KubernetesClient client, String namespace) {
            return client.pods().inNamespace(namespace).list().getItems();
        }

        @Override
        Map<String, Object> columns(HasMetadata item) {
            Pod pod = (Pod) item;
            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put("Phase", pod.getStatus() == null ? "" : nullToEmpty(pod.getStatus().getPhase()));
            columns.put("Node", pod.getSpec() == null ? "" : nullToEmpty(pod.getSpec().getNodeName()));
            return columns;
        }
    },
    SERVICES(Group.DISCOVERY, "services", "Services", List.of("Type", "Cluster IP")) {
        @Override
        List<? extends HasMetadata> list(KubernetesClient client, String namespace) {
            return client.services().inNamespace(namespace).list().getItems();
        }

        @Override
        Map<String, Object> columns(HasMetadata item) {
            Service service = (Service) item;
            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put("Type", service.getSpec() == null ? "" : nullToEmpty(service.getSpec().getType()));
            columns.put("Cluster IP", service.getSpec() == null ? "" : nullToEmpty(service.getSpec().getClusterIP()));
            return columns;
        }
    },
    CONFIG_MAPS(Group.CONFIG, "config-maps", "Config Maps", List.of("Keys")) {
        @Override
        List<? extends HasMetadata> list(KubernetesClient client, String namespace) {
            return client.configMaps().inNamespace(namespace).list().getItems();
        }

        @Override
        Map<String, Object> columns(HasMetadata item) {
            ConfigMap configMap = (ConfigMap) item;
            return Map.of("Keys", configMap.getData() == null ? 0 : configMap.getData().size());
        }
    },
    SECRETS(Group.CONFIG, "secrets", "Secrets", List.of("Type")) {
        @Override
        List<? extends HasMetadata> list(KubernetesClient client, String namespace) {
            return client.secrets().inNamespace(namespace).list().getItems();
        }

        @Override
        Map<String, Object> columns(HasMetadata item) {
            return Map.of("Type", nullToEmpty(((Secret) item).getType()));
        }
    };

    enum Group {
        WORKLOADS("workloads", "Workloads"),
        DISCOVERY("discovery-and-load-balancing", "Discovery and Load Balancing"),
        CONFIG("config-and-storage", "Config and Storage");

        final String path;
        final String title;

        Group(String path, String title) {
            this.path = path;
            this.title = title;
        }
    }

    final Group group;
    final String path;
    final String title;
    final List<String> extraColumns;

    OverviewResource(Group group, String path, String title, List<String> extraColumns) {
        this.group = group;
        this.path = path;
        this.title = title;
        this.extraColumns = extraColumns;
    }

    abstract List<? extends HasMetadata> list(KubernetesClient client, String namespace);

    abstract Map<String, Object> columns(HasMetadata item);

    String relativePath() {
        return group.path + "/" + path;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
