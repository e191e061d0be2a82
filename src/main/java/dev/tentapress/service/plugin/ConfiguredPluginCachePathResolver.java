package dev.tentapress.service.plugin;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Resolves the plugin cache from the {@code app.plugins.cache-path} setting.
 */
public class ConfiguredPluginCachePathResolver implements PluginCachePathResolver {

    private final String cachePath;

    public ConfiguredPluginCachePathResolver(String cachePath) {
        this.cachePath = cachePath;
    }

    @Override
    public Optional<Path> resolveCachePath() {
        if (cachePath == null || cachePath.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(cachePath).toAbsolutePath().normalize());
    }
}
