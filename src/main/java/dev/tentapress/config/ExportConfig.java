package dev.tentapress.config;

import dev.tentapress.service.ExportManifestFactory;
import dev.tentapress.service.storage.ExportStagingArea;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration(proxyBeanMethods = false)
@Slf4j
public class ExportConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Working directory for archives between assembly and download.
     * Relative paths resolve against the process working directory.
     */
    @Bean
    public ExportStagingArea exportStagingArea(
            @Value("${app.export.directory:storage/app/tp-exports}") String directory,
            Clock clock) {
        log.info("Configuring export staging area (directory={})", directory);
        return new ExportStagingArea(Path.of(directory), clock);
    }

    @Bean
    public ExportManifestFactory exportManifestFactory(Clock clock) {
        return new ExportManifestFactory(clock);
    }
}
