package dev.tentapress.repository;

import dev.tentapress.entity.Setting;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
@RequiredArgsConstructor
public class SettingRepositoryImpl implements SettingRepository {

    private final DatabaseClient databaseClient;

    // key and value are reserved words in H2
    private static final String FIND_ALL =
            "SELECT \"key\", \"value\", autoload FROM tp_settings ORDER BY \"key\"";

    @Override
    public Flux<Setting> findAllOrderByKey() {
        return databaseClient.sql(FIND_ALL)
                .map((row, meta) -> Setting.builder()
                        .key(row.get("key", String.class))
                        .value(row.get("value", String.class))
                        .autoload(row.get("autoload", Boolean.class))
                        .build())
                .all();
    }
}
