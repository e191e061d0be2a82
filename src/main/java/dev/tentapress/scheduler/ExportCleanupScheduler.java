package dev.tentapress.scheduler;

import dev.tentapress.service.storage.ExportStagingArea;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Removes archives left in the staging area by downloads that never started or never finished.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExportCleanupScheduler {

    private final ExportStagingArea stagingArea;

    @Value("${app.export.retention:PT1H}")
    private Duration retention;

    @Scheduled(fixedRateString = "${app.export.cleanup-rate-ms:900000}", initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void purgeStaleArchives() {
        stagingArea.purgeOlderThan(retention)
                .subscribe(
                        count -> {
                            if (count > 0) {
                                log.info("Purged {} stale export archive(s) older than {}", count, retention);
                            }
                        },
                        error -> log.error("Error purging stale export archives: {}", error.getMessage())
                );
    }
}
