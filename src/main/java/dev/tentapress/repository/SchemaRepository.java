package dev.tentapress.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only view of the live database schema.
 * Plugins install their own tables, so exporters check for them before querying.
 */
public interface SchemaRepository {

    Mono<Boolean> hasTable(String tableName);

    /**
     * Column names of the table, lower-cased. Empty when the table does not exist.
     */
    Flux<String> findColumnNames(String tableName);
}
