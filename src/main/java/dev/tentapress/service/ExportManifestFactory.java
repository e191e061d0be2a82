package dev.tentapress.service;

import dev.tentapress.dto.ExportManifest;
import dev.tentapress.dto.ExportOptions;
import dev.tentapress.service.collector.ExportDomain;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds the manifest describing a finished archive.
 */
public class ExportManifestFactory {

    public static final int SCHEMA_VERSION = 1;
    public static final String APP_NAME = "TentaPress";

    private final Clock clock;

    public ExportManifestFactory(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param options the flags the export was requested with
     * @param written the domains whose entry was actually added to the archive
     */
    public ExportManifest build(ExportOptions options, Set<ExportDomain> written) {
        Map<String, Boolean> includes = new LinkedHashMap<>();
        for (ExportDomain domain : ExportDomain.values()) {
            // omitted domains report presence, the rest report the request
            boolean included = domain.absencePolicy() == ExportDomain.AbsencePolicy.OMIT
                    ? written.contains(domain)
                    : domain.isRequested(options);
            includes.put(domain.key(), included);
        }

        return ExportManifest.builder()
                .schemaVersion(SCHEMA_VERSION)
                .generatedAtUtc(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString())
                .app(new ExportManifest.AppInfo(APP_NAME))
                .includes(includes)
                .build();
    }
}
