package dev.tentapress.config;

import dev.tentapress.service.theme.FilesystemThemeManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration(proxyBeanMethods = false)
@Slf4j
public class ThemeConfig {

    /**
     * Theme manager backed by the themes directory.
     * Only present when an active theme is configured; without it theme exports
     * report the theme manager as unavailable.
     */
    @Bean
    @ConditionalOnProperty(name = "app.theme.active")
    public FilesystemThemeManager filesystemThemeManager(
            @Value("${app.theme.active}") String activeTheme,
            @Value("${app.theme.path:themes}") String themesPath) {
        log.info("Configuring filesystem theme manager (active={}, path={})", activeTheme, themesPath);
        return new FilesystemThemeManager(activeTheme, Path.of(themesPath));
    }
}
