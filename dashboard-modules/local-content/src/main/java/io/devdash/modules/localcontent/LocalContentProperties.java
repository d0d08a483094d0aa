package io.devdash.modules.localcontent;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * @param root directory holding the {@code *.json} content documents
 */
@ConfigurationProperties(prefix = "devdash.local-content")
public record LocalContentProperties(Path root) {
}
