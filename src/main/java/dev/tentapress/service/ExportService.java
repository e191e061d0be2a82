package dev.tentapress.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tentapress.dto.ArchiveResult;
import dev.tentapress.dto.ExportManifest;
import dev.tentapress.dto.ExportOptions;
import dev.tentapress.metrics.ExportMetrics;
import dev.tentapress.service.collector.CollectorResult;
import dev.tentapress.service.collector.DomainCollector;
import dev.tentapress.service.collector.ExportDomain;
import dev.tentapress.service.storage.ExportArchive;
import dev.tentapress.service.storage.ExportStagingArea;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Assembles export archives: one JSON entry per requested domain, in a fixed order,
 * followed by {@code manifest.json}.
 * <p>
 * An unavailable domain never aborts the export. Depending on the domain it is either
 * written as an error-annotated placeholder or left out; the manifest reflects which.
 * Only failures of the container itself abort, and then the partial file is removed.
 */
@Service
@Slf4j
public class ExportService {

    static final String MANIFEST_ENTRY = "manifest.json";

    private final Map<ExportDomain, DomainCollector> collectors;
    private final ExportStagingArea stagingArea;
    private final ExportManifestFactory manifestFactory;
    private final ObjectMapper objectMapper;
    private final ExportMetrics exportMetrics;

    public ExportService(List<DomainCollector> collectors,
                         ExportStagingArea stagingArea,
                         ExportManifestFactory manifestFactory,
                         ObjectMapper objectMapper,
                         ExportMetrics exportMetrics) {
        this.collectors = indexByDomain(collectors);
        this.stagingArea = stagingArea;
        this.manifestFactory = manifestFactory;
        this.objectMapper = objectMapper;
        this.exportMetrics = exportMetrics;
    }

    private static Map<ExportDomain, DomainCollector> indexByDomain(List<DomainCollector> collectors) {
        Map<ExportDomain, DomainCollector> byDomain = new EnumMap<>(ExportDomain.class);
        for (DomainCollector collector : collectors) {
            DomainCollector previous = byDomain.put(collector.domain(), collector);
            if (previous != null) {
                throw new IllegalStateException("Duplicate collector for domain " + collector.domain()
                        + ": " + previous.getClass().getSimpleName() + " and " + collector.getClass().getSimpleName());
            }
        }
        for (ExportDomain domain : ExportDomain.values()) {
            if (!byDomain.containsKey(domain)) {
                throw new IllegalStateException("No collector registered for domain " + domain);
            }
        }
        return byDomain;
    }

    /**
     * Build a complete archive in the staging area.
     *
     * @return the sealed archive; the caller owns the file and should {@link #discardArchive discard} it
     *         once delivered
     */
    public Mono<ArchiveResult> createExportArchive(ExportOptions options) {
        return Mono.defer(() -> {
            Timer.Sample sample = exportMetrics.startTimer();
            log.info("Starting export: {}", options);

            return Mono.fromCallable(stagingArea::allocate)
                    .subscribeOn(Schedulers.boundedElastic())
                    .flatMap(target -> writeArchive(target, options)
                            .onErrorResume(e -> stagingArea.discard(target.path()).then(Mono.error(e))))
                    .doOnSuccess(result -> {
                        exportMetrics.recordSuccess(sample);
                        log.info("Export archive ready: {}", result.filename());
                    })
                    .doOnError(e -> {
                        exportMetrics.recordFailure(sample);
                        log.error("Export failed: {}", e.getMessage(), e);
                    });
        });
    }

    /**
     * Remove a delivered or abandoned archive.
     */
    public Mono<Void> discardArchive(ArchiveResult archive) {
        return stagingArea.discard(archive.path());
    }

    private Mono<ArchiveResult> writeArchive(ArchiveResult target, ExportOptions options) {
        return Mono.usingWhen(
                Mono.fromCallable(() -> ExportArchive.create(target.path(), objectMapper))
                        .subscribeOn(Schedulers.boundedElastic()),
                archive -> assemble(archive, options),
                archive -> Mono.fromRunnable(archive::seal).subscribeOn(Schedulers.boundedElastic()),
                (archive, error) -> release(archive),
                // the zip must be closed before its file can be removed
                archive -> release(archive).then(stagingArea.discard(target.path()))
        ).then(Mono.just(target));
    }

    private Mono<Void> assemble(ExportArchive archive, ExportOptions options) {
        return Flux.fromArray(ExportDomain.values())
                .filter(domain -> domain.isRequested(options))
                .concatMap(domain -> exportSection(domain)
                        .flatMap(result -> writeSection(archive, domain, result)))
                .collect(() -> EnumSet.noneOf(ExportDomain.class), Set::add)
                .flatMap(written -> {
                    ExportManifest manifest = manifestFactory.build(options, written);
                    return writeEntry(archive, MANIFEST_ENTRY, manifest);
                });
    }

    private Mono<CollectorResult> exportSection(ExportDomain domain) {
        DomainCollector collector = collectors.get(domain);
        return Mono.defer(collector::collect)
                .switchIfEmpty(Mono.fromSupplier(() ->
                        CollectorResult.unavailable(domain.key() + " export failed: no result.")))
                .onErrorResume(e -> {
                    log.warn("Collector for {} failed, exporting it as unavailable: {}", domain.key(), e.getMessage(), e);
                    return Mono.just(CollectorResult.unavailable(domain.key() + " export failed: " + e.getMessage()));
                });
    }

    private Mono<ExportDomain> writeSection(ExportArchive archive, ExportDomain domain, CollectorResult result) {
        if (result instanceof CollectorResult.Collected collected) {
            return writeEntry(archive, domain.entryName(), collected.document()).thenReturn(domain);
        }

        String reason = ((CollectorResult.Unavailable) result).reason();
        exportMetrics.recordDegradedSection(domain);
        if (domain.absencePolicy() == ExportDomain.AbsencePolicy.OMIT) {
            log.info("Skipping {}: {}", domain.entryName(), reason);
            return Mono.empty();
        }

        log.warn("Writing placeholder for {}: {}", domain.entryName(), reason);
        Object placeholder = collectors.get(domain).placeholder(reason);
        return writeEntry(archive, domain.entryName(), placeholder).thenReturn(domain);
    }

    private Mono<Void> writeEntry(ExportArchive archive, String entryName, Object document) {
        return Mono.<Void>fromRunnable(() -> archive.writeJson(entryName, document))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private Mono<Void> release(ExportArchive archive) {
        return Mono.<Void>fromCallable(() -> {
            archive.close();
            return null;
        }).subscribeOn(Schedulers.boundedElastic())
          .onErrorResume(IOException.class, e -> {
              log.warn("Failed to close export archive {}: {}", archive.getPath(), e.getMessage());
              return Mono.empty();
          });
    }
}
