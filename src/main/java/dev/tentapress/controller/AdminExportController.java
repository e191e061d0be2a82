package dev.tentapress.controller;

import dev.tentapress.dto.ExportOptions;
import dev.tentapress.service.ExportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/export")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
@Tag(name = "Admin - Export", description = "Portable site export archives")
@SecurityRequirement(name = "basicAuth")
@Slf4j
public class AdminExportController {

    static final MediaType APPLICATION_ZIP = MediaType.parseMediaType("application/zip");
    private static final int BUFFER_SIZE = 8192;

    private final ExportService exportService;

    /**
     * The archive is streamed from the staging area and deleted once the response body
     * completes, fails or is cancelled.
     */
    @PostMapping("/run")
    @Operation(summary = "Run an export", description = "Build a zip archive of site content and download it")
    public Mono<ResponseEntity<Flux<DataBuffer>>> runExport(
            @Parameter(description = "Include settings.json")
            @RequestParam(name = "include_settings", required = false) Boolean includeSettings,
            @Parameter(description = "Include theme.json")
            @RequestParam(name = "include_theme", required = false) Boolean includeTheme,
            @Parameter(description = "Include plugins.json")
            @RequestParam(name = "include_plugins", required = false) Boolean includePlugins,
            @Parameter(description = "Include seo.json when SEO data exists")
            @RequestParam(name = "include_seo", required = false) Boolean includeSeo) {
        ExportOptions options = ExportOptions.of(includeSettings, includeTheme, includePlugins, includeSeo);
        log.info("Export requested: {}", options);

        return exportService.createExportArchive(options)
                .map(archive -> {
                    Flux<DataBuffer> body = DataBufferUtils
                            .read(archive.path(), new DefaultDataBufferFactory(), BUFFER_SIZE)
                            .doFinally(signal -> exportService.discardArchive(archive).subscribe());

                    return ResponseEntity.ok()
                            .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                    .filename(archive.filename())
                                    .build()
                                    .toString())
                            .contentType(APPLICATION_ZIP)
                            .body(body);
                });
    }
}
