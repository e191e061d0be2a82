package dev.tentapress.service.plugin;

import dev.tentapress.repository.PluginRepository;
import dev.tentapress.repository.SchemaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Enabled plugins as recorded in the {@code tp_plugins} registry table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DatabasePluginRegistry implements EnabledPluginSource {

    static final String PLUGINS_TABLE = "tp_plugins";

    private final SchemaRepository schemaRepository;
    private final PluginRepository pluginRepository;

    @Override
    public Flux<String> enabledPluginIds() {
        return schemaRepository.hasTable(PLUGINS_TABLE)
                .flatMapMany(exists -> {
                    if (!Boolean.TRUE.equals(exists)) {
                        log.debug("Plugin registry table {} not found", PLUGINS_TABLE);
                        return Flux.empty();
                    }
                    return pluginRepository.findEnabledIds();
                });
    }
}
