package dev.tentapress.service.plugin;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Locates the precomputed plugin cache file. The file may not exist yet.
 */
@FunctionalInterface
public interface PluginCachePathResolver {

    Optional<Path> resolveCachePath();
}
