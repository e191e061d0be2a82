package dev.tentapress.service.collector;

import dev.tentapress.dto.RecordListDocument;
import dev.tentapress.dto.SeoExportData;
import dev.tentapress.entity.SeoPage;
import dev.tentapress.repository.SchemaRepository;
import dev.tentapress.repository.SeoPageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Exports per-page SEO metadata. Without the SEO plugin's table the domain does not apply
 * and nothing is written for it.
 */
@Component
@RequiredArgsConstructor
public class SeoExportCollector implements DomainCollector {

    static final String SEO_TABLE = "tp_seo_pages";
    static final String NOT_FOUND = "SEO table tp_seo_pages not found.";

    private final SchemaRepository schemaRepository;
    private final SeoPageRepository seoPageRepository;

    @Override
    public ExportDomain domain() {
        return ExportDomain.SEO;
    }

    @Override
    public Mono<CollectorResult> collect() {
        return schemaRepository.hasTable(SEO_TABLE)
                .flatMap(exists -> {
                    if (!Boolean.TRUE.equals(exists)) {
                        return Mono.just(CollectorResult.unavailable(NOT_FOUND));
                    }
                    return seoPageRepository.findAllOrderByPageId()
                            .map(SeoExportCollector::toExportData)
                            .collectList()
                            .map(items -> CollectorResult.collected(RecordListDocument.of(items)));
                });
    }

    static SeoExportData toExportData(SeoPage seo) {
        return SeoExportData.builder()
                .pageId(seo.getPageId() != null ? seo.getPageId() : 0L)
                .title(seo.getTitle())
                .description(seo.getDescription())
                .canonicalUrl(seo.getCanonicalUrl())
                .robots(seo.getRobots())
                .ogTitle(seo.getOgTitle())
                .ogDescription(seo.getOgDescription())
                .ogImage(seo.getOgImage())
                .twitterTitle(seo.getTwitterTitle())
                .twitterDescription(seo.getTwitterDescription())
                .twitterImage(seo.getTwitterImage())
                .build();
    }
}
