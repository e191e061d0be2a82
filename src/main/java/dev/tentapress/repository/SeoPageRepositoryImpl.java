package dev.tentapress.repository;

import dev.tentapress.entity.SeoPage;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

/**
 * Reads the SEO plugin's per-page table. Columns added by later plugin versions
 * are read only when present.
 */
@Repository
@RequiredArgsConstructor
public class SeoPageRepositoryImpl implements SeoPageRepository {

    private final DatabaseClient databaseClient;

    private static final String FIND_ALL = "SELECT * FROM tp_seo_pages ORDER BY page_id";

    @Override
    public Flux<SeoPage> findAllOrderByPageId() {
        return databaseClient.sql(FIND_ALL)
                .map(SeoPageRepositoryImpl::toSeoPage)
                .all();
    }

    private static SeoPage toSeoPage(Row row, RowMetadata meta) {
        return SeoPage.builder()
                .pageId(row.get("page_id", Long.class))
                .title(text(row, meta, "title"))
                .description(text(row, meta, "description"))
                .canonicalUrl(text(row, meta, "canonical_url"))
                .robots(text(row, meta, "robots"))
                .ogTitle(text(row, meta, "og_title"))
                .ogDescription(text(row, meta, "og_description"))
                .ogImage(text(row, meta, "og_image"))
                .twitterTitle(text(row, meta, "twitter_title"))
                .twitterDescription(text(row, meta, "twitter_description"))
                .twitterImage(text(row, meta, "twitter_image"))
                .build();
    }

    private static String text(Row row, RowMetadata meta, String column) {
        return meta.contains(column) ? row.get(column, String.class) : null;
    }
}
