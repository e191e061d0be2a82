package dev.tentapress.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Locale;

/**
 * Schema lookups through {@code information_schema}, which both PostgreSQL and H2 expose.
 */
@Repository
@RequiredArgsConstructor
public class SchemaRepositoryImpl implements SchemaRepository {

    private final DatabaseClient databaseClient;

    private static final String FIND_TABLE =
            "SELECT table_name FROM information_schema.tables " +
            "WHERE LOWER(table_name) = LOWER(:tableName) " +
            "AND LOWER(table_schema) NOT IN ('information_schema', 'pg_catalog')";

    private static final String FIND_COLUMNS =
            "SELECT column_name FROM information_schema.columns " +
            "WHERE LOWER(table_name) = LOWER(:tableName) " +
            "AND LOWER(table_schema) NOT IN ('information_schema', 'pg_catalog')";

    @Override
    public Mono<Boolean> hasTable(String tableName) {
        return databaseClient.sql(FIND_TABLE)
                .bind("tableName", tableName)
                .fetch()
                .first()
                .hasElement();
    }

    @Override
    public Flux<String> findColumnNames(String tableName) {
        return databaseClient.sql(FIND_COLUMNS)
                .bind("tableName", tableName)
                .map((row, meta) -> row.get("column_name", String.class))
                .all()
                .map(name -> name.toLowerCase(Locale.ROOT));
    }
}
