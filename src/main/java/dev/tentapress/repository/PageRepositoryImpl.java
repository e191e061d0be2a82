package dev.tentapress.repository;

import dev.tentapress.entity.Page;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
@RequiredArgsConstructor
public class PageRepositoryImpl implements PageRepository {

    private final DatabaseClient databaseClient;

    // SELECT * so that status/layout/blocks come along only where the schema has them
    private static final String FIND_ALL = "SELECT * FROM tp_pages ORDER BY id";

    @Override
    public Flux<Page> findAllOrderById() {
        return databaseClient.sql(FIND_ALL)
                .map(PageRepositoryImpl::toPage)
                .all();
    }

    private static Page toPage(Row row, RowMetadata meta) {
        return Page.builder()
                .id(row.get("id", Long.class))
                .title(row.get("title", String.class))
                .slug(row.get("slug", String.class))
                .createdAt(optional(row, meta, "created_at", LocalDateTime.class))
                .updatedAt(optional(row, meta, "updated_at", LocalDateTime.class))
                .status(optional(row, meta, "status", String.class))
                .layout(optional(row, meta, "layout", String.class))
                .blocks(optional(row, meta, "blocks", String.class))
                .build();
    }

    private static <T> T optional(Row row, RowMetadata meta, String column, Class<T> type) {
        return meta.contains(column) ? row.get(column, type) : null;
    }
}
