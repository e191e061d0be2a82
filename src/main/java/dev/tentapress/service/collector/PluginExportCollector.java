package dev.tentapress.service.collector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tentapress.dto.PluginExportData;
import dev.tentapress.service.plugin.EnabledPluginSource;
import dev.tentapress.service.plugin.PluginCachePathResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Exports the enabled plugin ids.
 * The plugin cache file ({@code {"enabled": [...]}}) is authoritative when it can be read;
 * otherwise the first registered {@link EnabledPluginSource} is asked. Never fails the export.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PluginExportCollector implements DomainCollector {

    private final ObjectProvider<PluginCachePathResolver> cachePathResolvers;
    private final ObjectProvider<EnabledPluginSource> pluginSources;
    private final ObjectMapper objectMapper;

    @Override
    public ExportDomain domain() {
        return ExportDomain.PLUGINS;
    }

    @Override
    public Mono<CollectorResult> collect() {
        return Mono.fromCallable(this::readCache)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(lookup -> {
                    if (lookup.enabled().isPresent()) {
                        log.debug("Using plugin cache {}", lookup.cachePath());
                        return Mono.just(new PluginExportData(lookup.enabled().get(), lookup.cachePath()));
                    }
                    return enabledFromRegistry()
                            .map(ids -> new PluginExportData(ids, lookup.cachePath()));
                })
                .map(CollectorResult::collected);
    }

    @Override
    public Object placeholder(String reason) {
        return new PluginExportData(List.of(), null, reason);
    }

    private CacheLookup readCache() {
        PluginCachePathResolver resolver = cachePathResolvers.getIfAvailable();
        Optional<Path> cachePath = resolver != null ? resolver.resolveCachePath() : Optional.empty();
        if (cachePath.isEmpty()) {
            return new CacheLookup(null, Optional.empty());
        }
        Path path = cachePath.get();
        return new CacheLookup(path.toString(), readEnabled(path));
    }

    private Optional<List<String>> readEnabled(Path path) {
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            JsonNode cache = objectMapper.readTree(path.toFile());
            JsonNode enabled = cache != null ? cache.path("enabled") : null;
            if (enabled == null || !enabled.isArray()) {
                log.debug("Plugin cache {} has no enabled list", path);
                return Optional.empty();
            }
            List<String> ids = new ArrayList<>(enabled.size());
            enabled.forEach(id -> ids.add(stringify(id)));
            return Optional.of(ids);
        } catch (IOException e) {
            log.warn("Plugin cache {} unreadable, falling back to the plugin registry: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private Mono<List<String>> enabledFromRegistry() {
        Optional<EnabledPluginSource> source = pluginSources.orderedStream().findFirst();
        if (source.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.defer(() -> source.get().enabledPluginIds())
                .collectList()
                .onErrorResume(e -> {
                    log.warn("Plugin registry lookup failed, exporting no enabled plugins: {}", e.getMessage());
                    return Mono.just(List.of());
                });
    }

    // null and false become "", true becomes "1"
    static String stringify(JsonNode id) {
        if (id.isNull()) {
            return "";
        }
        if (id.isBoolean()) {
            return id.booleanValue() ? "1" : "";
        }
        return id.isValueNode() ? id.asText() : id.toString();
    }

    private record CacheLookup(String cachePath, Optional<List<String>> enabled) {}
}
