package io.devdash.dashboard.registry;

import io.devdash.common.module.ContentPaths;
import io.devdash.common.module.DashboardModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of the registered dashboard modules, in registration order, keyed by content prefix.
 * Instances are produced by {@link Builder#build()}; nothing can be registered afterwards.
 */
public final class ModuleRegistry {

    private final List<Entry> entries;
    private final Map<String, Entry> byContentPath;

    private ModuleRegistry(List<Entry> entries) {
        this.entries = List.copyOf(entries);
        Map<String, Entry> paths = new LinkedHashMap<>();
        for (Entry entry : this.entries) {
            paths.put(entry.contentPath(), entry);
        }
        this.byContentPath = Collections.unmodifiableMap(paths);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ModuleRegistry empty() {
        return new ModuleRegistry(List.of());
    }

    public List<Entry> entries() {
        return entries;
    }

    public List<DashboardModule> modules() {
        return entries.stream().map(Entry::module).toList();
    }

    public int size() {
        return entries.size();
    }

    public Optional<Entry> get(String contentPath) {
        return Optional.ofNullable(byContentPath.get(ContentPaths.clean(contentPath)));
    }

    public Optional<String> contentPath(DashboardModule module) {
        return entries.stream()
                .filter(entry -> entry.module() == module)
                .map(Entry::contentPath)
                .findFirst();
    }

    /**
     * Finds the module owning {@code path} by longest registered prefix. Prefixes match whole
     * segments only, so {@code /content/over} never resolves to {@code /content/overview}.
     */
    public Optional<Match> resolve(String path) {
        String normalized = ContentPaths.clean(path);
        Entry best = null;
        for (Entry entry : entries) {
            String prefix = entry.contentPath();
            boolean matches = normalized.equals(prefix) || normalized.startsWith(prefix + "/");
            if (matches && (best == null || prefix.length() > best.contentPath().length())) {
                best = entry;
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        String suffix = normalized.substring(best.contentPath().length());
        if (suffix.startsWith("/")) {
            suffix = suffix.substring(1);
        }
        return Optional.of(new Match(best, suffix));
    }

    /**
     * A registered module.
     *
     * @param contentPath computed content prefix, e.g. {@code /content/overview}
     * @param module      the module
     * @param position    zero-based registration position
     */
    public record Entry(String contentPath, DashboardModule module, int position) {
        public String name() {
            return module.name();
        }
    }

    /**
     * @param entry  owning module
     * @param suffix remainder of the path below the module prefix, without a leading slash
     */
    public record Match(Entry entry, String suffix) {
    }

    public static final class Builder {
        private static final Logger log = LoggerFactory.getLogger(ModuleRegistry.class);

        private final List<Entry> entries = new ArrayList<>();
        private final Map<String, Entry> byContentPath = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a module under {@value ContentPaths#CONTENT_ROOT}/{@code module.contentPath()}.
         *
         * @throws DuplicateContentPathException when the computed prefix is already taken; the
         *                                       builder is left unchanged
         */
        public Builder register(DashboardModule module) {
            Objects.requireNonNull(module, "module");
            String modulePath = module.contentPath();
            if (modulePath == null || ContentPaths.clean(modulePath).replace("/", "").isEmpty()) {
                throw new IllegalArgumentException("Module " + module.name() + " has no content path");
            }
            String contentPath = ContentPaths.contentPrefix(modulePath);
            if (!contentPath.startsWith(ContentPaths.CONTENT_ROOT + "/")) {
                throw new IllegalArgumentException("Content path of module " + module.name()
                        + " escapes " + ContentPaths.CONTENT_ROOT + ": " + modulePath);
            }

            Entry existing = byContentPath.get(contentPath);
            if (existing != null) {
                throw new DuplicateContentPathException(contentPath, existing.name(), module.name());
            }

            log.debug("Registering content path {} for module {}", contentPath, module.name());
            Entry entry = new Entry(contentPath, module, entries.size());
            entries.add(entry);
            byContentPath.put(contentPath, entry);
            return this;
        }

        public ModuleRegistry build() {
            return new ModuleRegistry(entries);
        }
    }
}
