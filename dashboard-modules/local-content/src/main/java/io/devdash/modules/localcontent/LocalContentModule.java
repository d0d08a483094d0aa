package io.devdash.modules.localcontent;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.devdash.common.model.ContentResponse;
import io.devdash.common.model.ContentView;
import io.devdash.common.model.NavigationSection;
import io.devdash.common.module.ContentHandler;
import io.devdash.common.module.ContentNotFoundException;
import io.devdash.common.module.ContentPaths;
import io.devdash.common.module.ContentRequest;
import io.devdash.common.module.DashboardModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Serves JSON content documents from a local directory. Each {@code <name>.json} file is
 * reachable at {@code <prefix>/<name>}. Namespaces do not apply.
 */
public class LocalContentModule implements DashboardModule {
    private static final Logger log = LoggerFactory.getLogger(LocalContentModule.class);

    static final String CONTENT_PATH = "local";
    private static final String EXTENSION = ".json";
    private static final Pattern DOCUMENT_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path root;
    private final ObjectMapper objectMapper;

    public LocalContentModule(Path root, ObjectMapper objectMapper) {
        this.root = Objects.requireNonNull(root, "root");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public String name() {
        return "local-content";
    }

    @Override
    public String contentPath() {
        return CONTENT_PATH;
    }

    @Override
    public Mono<NavigationSection> navigation(String namespace, String contentPath) {
        return Mono.fromCallable(() -> {
                    List<NavigationSection> children = new ArrayList<>();
                    for (Path file : documents()) {
                        children.add(NavigationSection.of(read(file).title(),
                                ContentPaths.join(contentPath, documentName(file))));
                    }
                    return NavigationSection.of("Local Contents", contentPath, children);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public ContentHandler contentHandler() {
        return request -> Mono.fromCallable(() -> render(request))
                .subscribeOn(Schedulers.boundedElastic());
    }

    ContentResponse render(ContentRequest request) {
        String name = ContentPaths.clean(request.path());
        if (name.isEmpty()) {
            return index();
        }
        if (!DOCUMENT_NAME.matcher(name).matches()) {
            throw new ContentNotFoundException(request.path());
        }
        Path file = root.resolve(name + EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new ContentNotFoundException(request.path());
        }
        return read(file);
    }

    private ContentResponse index() {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Path file : documents()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("Title", read(file).title());
            row.put("File", file.getFileName().toString());
            rows.add(row);
        }
        return ContentResponse.of("Local Contents",
                ContentView.table("Local Contents", List.of("Title", "File"), rows));
    }

    List<Path> documents() {
        if (!Files.isDirectory(root)) {
            log.warn("Local content root {} is not a directory", root);
            return List.of();
        }
        try (Stream<Path> files = Files.list(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(EXTENSION))
                    .sorted(Comparator.comparing(file -> file.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list local content in " + root, e);
        }
    }

    private ContentResponse read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), ContentResponse.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read local content " + file.getFileName(), e);
        }
    }

    private static String documentName(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - EXTENSION.length());
    }
}
