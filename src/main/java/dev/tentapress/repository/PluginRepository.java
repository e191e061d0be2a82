package dev.tentapress.repository;

import reactor.core.publisher.Flux;

public interface PluginRepository {

    /**
     * Ids of plugins flagged enabled in the plugin registry table, ordered by id.
     */
    Flux<String> findEnabledIds();
}
