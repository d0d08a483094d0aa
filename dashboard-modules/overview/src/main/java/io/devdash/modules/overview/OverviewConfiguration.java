package io.devdash.modules.overview;

import io.devdash.common.module.DashboardModule;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

@Configuration
@ConditionalOnProperty(prefix = "devdash.overview", name = "enabled", havingValue = "true", matchIfMissing = true)
public class OverviewConfiguration {

    @Bean
    @Order(0)
    DashboardModule overviewModule(ObjectProvider<KubernetesClient> clientProvider) {
        return new OverviewModule(clientProvider);
    }
}
