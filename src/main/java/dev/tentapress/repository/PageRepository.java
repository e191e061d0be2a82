package dev.tentapress.repository;

import dev.tentapress.entity.Page;
import reactor.core.publisher.Flux;

public interface PageRepository {

    /**
     * All pages ordered by id ascending. Optional columns missing from the
     * installed schema are left null on the returned rows.
     */
    Flux<Page> findAllOrderById();
}
