package dev.tentapress.service.plugin;

import reactor.core.publisher.Flux;

/**
 * Live view of the plugin registry, consulted when the plugin cache is missing or unusable.
 */
@FunctionalInterface
public interface EnabledPluginSource {

    Flux<String> enabledPluginIds();
}
