package io.devdash.modules.localcontent;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.devdash.common.module.DashboardModule;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

@Configuration
@ConditionalOnProperty(prefix = "devdash.local-content", name = "root")
@EnableConfigurationProperties(LocalContentProperties.class)
public class LocalContentConfiguration {

    @Bean
    @Order(100)
    DashboardModule localContentModule(LocalContentProperties properties,
                                       ObjectProvider<ObjectMapper> objectMapper) {
        return new LocalContentModule(properties.root(), objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
