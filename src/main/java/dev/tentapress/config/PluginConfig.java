package dev.tentapress.config;

import dev.tentapress.service.plugin.ConfiguredPluginCachePathResolver;
import dev.tentapress.service.plugin.PluginCachePathResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration(proxyBeanMethods = false)
public class PluginConfig {

    @Bean
    @ConditionalOnProperty(name = "app.plugins.cache-path")
    public PluginCachePathResolver pluginCachePathResolver(@Value("${app.plugins.cache-path}") String cachePath) {
        return new ConfiguredPluginCachePathResolver(cachePath);
    }
}
