package dev.tentapress.service.plugin;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ConfiguredPluginCachePathResolverTest {

    @Test
    @DisplayName("Should resolve a configured path to an absolute, normalized path")
    void resolvesPath() {
        ConfiguredPluginCachePathResolver resolver = new ConfiguredPluginCachePathResolver("bootstrap/./cache/tp_plugins.json");

        assertThat(resolver.resolveCachePath())
                .contains(Path.of("bootstrap/cache/tp_plugins.json").toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("Should resolve nothing for a blank path")
    void blankPath() {
        assertThat(new ConfiguredPluginCachePathResolver(" ").resolveCachePath()).isEmpty();
        assertThat(new ConfiguredPluginCachePathResolver(null).resolveCachePath()).isEmpty();
    }
}
