package dev.tentapress.repository;

import dev.tentapress.entity.SeoPage;
import reactor.core.publisher.Flux;

public interface SeoPageRepository {

    Flux<SeoPage> findAllOrderByPageId();
}
