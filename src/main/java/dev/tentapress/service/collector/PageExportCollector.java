package dev.tentapress.service.collector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tentapress.dto.PageExportData;
import dev.tentapress.dto.RecordListDocument;
import dev.tentapress.entity.Page;
import dev.tentapress.repository.PageRepository;
import dev.tentapress.repository.SchemaRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Exports every page, ordered by id.
 * The optional columns are resolved once per export into a {@link PageSchema}
 * and only the fields that schema defines are emitted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PageExportCollector implements DomainCollector {

    static final String PAGES_TABLE = "tp_pages";
    static final String NOT_INSTALLED = "Pages plugin not installed.";

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final SchemaRepository schemaRepository;
    private final PageRepository pageRepository;
    private final ObjectMapper objectMapper;

    @Override
    public ExportDomain domain() {
        return ExportDomain.PAGES;
    }

    @Override
    public Mono<CollectorResult> collect() {
        return schemaRepository.hasTable(PAGES_TABLE)
                .flatMap(exists -> {
                    if (!Boolean.TRUE.equals(exists)) {
                        return Mono.just(CollectorResult.unavailable(NOT_INSTALLED));
                    }
                    return schemaRepository.findColumnNames(PAGES_TABLE)
                            .collectList()
                            .map(PageSchema::fromColumns)
                            .flatMap(this::exportPages);
                });
    }

    /**
     * Export all pages against an already resolved schema.
     */
    public Mono<CollectorResult> exportPages(PageSchema schema) {
        log.debug("Exporting pages with optional columns {}", schema.optionalColumns());
        return pageRepository.findAllOrderById()
                .map(page -> toExportData(page, schema))
                .collectList()
                .map(items -> CollectorResult.collected(RecordListDocument.of(items)));
    }

    PageExportData toExportData(Page page, PageSchema schema) {
        PageExportData.PageExportDataBuilder data = PageExportData.builder()
                .id(page.getId() != null ? page.getId() : 0L)
                .title(page.getTitle() != null ? page.getTitle() : "")
                .slug(page.getSlug() != null ? page.getSlug() : "")
                .createdAt(formatTimestamp(page.getCreatedAt()))
                .updatedAt(formatTimestamp(page.getUpdatedAt()));

        if (schema.hasStatus()) {
            data.status(page.getStatus() != null ? page.getStatus() : "");
        }
        if (schema.hasLayout()) {
            data.layout(page.getLayout() != null ? page.getLayout() : "");
        }
        if (schema.hasBlocks()) {
            data.blocks(parseBlocks(page));
        }
        return data.build();
    }

    private JsonNode parseBlocks(Page page) {
        String raw = page.getBlocks();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createArrayNode();
        }
        try {
            JsonNode blocks = objectMapper.readTree(raw);
            return blocks != null && blocks.isArray() ? blocks : objectMapper.createArrayNode();
        } catch (JsonProcessingException e) {
            log.warn("Page {} has malformed blocks JSON, exporting an empty list: {}",
                    page.getId(), e.getOriginalMessage());
            return objectMapper.createArrayNode();
        }
    }

    private static String formatTimestamp(LocalDateTime value) {
        return value != null ? value.format(TIMESTAMP_FORMAT) : null;
    }
}
