package dev.tentapress.repository;

import dev.tentapress.entity.Setting;
import reactor.core.publisher.Flux;

public interface SettingRepository {

    /**
     * Every settings row, autoloaded or not, ordered by key.
     */
    Flux<Setting> findAllOrderByKey();
}
