package dev.tentapress.health;

import dev.tentapress.service.storage.ExportStagingArea;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports whether the export staging directory can receive new archives.
 */
@Component("exportStorage")
@RequiredArgsConstructor
@Slf4j
public class ExportStorageHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ExportStagingArea stagingArea;

    @Override
    public Mono<Health> health() {
        String directory = stagingArea.getDirectory().toString();
        return stagingArea.isWritable()
                .timeout(TIMEOUT)
                .map(writable -> writable
                        ? Health.up().withDetail("directory", directory).build()
                        : Health.down().withDetail("directory", directory)
                                .withDetail("reason", "Directory is not writable").build())
                .onErrorResume(ex -> {
                    log.error("Export storage health check failed: {}", ex.getMessage());
                    return Mono.just(Health.down()
                            .withDetail("directory", directory)
                            .withDetail("error", ex.getClass().getSimpleName())
                            .build());
                });
    }
}
