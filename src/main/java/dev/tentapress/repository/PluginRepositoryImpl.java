package dev.tentapress.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
@RequiredArgsConstructor
public class PluginRepositoryImpl implements PluginRepository {

    private final DatabaseClient databaseClient;

    private static final String FIND_ENABLED =
            "SELECT id FROM tp_plugins WHERE enabled = TRUE ORDER BY id";

    @Override
    public Flux<String> findEnabledIds() {
        return databaseClient.sql(FIND_ENABLED)
                .map((row, meta) -> row.get("id", String.class))
                .all();
    }
}
