package dev.tentapress.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tentapress.dto.PageExportData;
import dev.tentapress.dto.RecordListDocument;
import dev.tentapress.entity.Page;
import dev.tentapress.service.collector.CollectorResult;
import dev.tentapress.service.collector.PageExportCollector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class PageRepositoryImplTest {

    @Test
    @DisplayName("Should return pages in ascending id order with every column mapped")
    void ordersById() {
        DatabaseClient client = H2Databases.withSchema();
        H2Databases.execute(client,
                "INSERT INTO tp_pages (id, title, slug, status, layout, blocks, created_at, updated_at) VALUES "
                        + "(3, 'Contact', 'contact', 'draft', 'default', '[]', "
                        + "TIMESTAMP '2026-10-19 11:55:07', TIMESTAMP '2026-10-19 12:00:00')",
                "INSERT INTO tp_pages (id, title, slug, status, layout, blocks, created_at, updated_at) VALUES "
                        + "(1, 'Home', 'home', 'published', 'landing', '[{\"type\":\"hero\"}]', "
                        + "TIMESTAMP '2026-01-02 03:04:05', NULL)",
                "INSERT INTO tp_pages (id, title, slug) VALUES (2, 'About', 'about')");

        StepVerifier.create(new PageRepositoryImpl(client).findAllOrderById().collectList())
                .assertNext(pages -> {
                    assertThat(pages).extracting(Page::getId).containsExactly(1L, 2L, 3L);
                    assertThat(pages.get(0)).isEqualTo(Page.builder()
                            .id(1L)
                            .title("Home")
                            .slug("home")
                            .status("published")
                            .layout("landing")
                            .blocks("[{\"type\":\"hero\"}]")
                            .createdAt(LocalDateTime.of(2026, 1, 2, 3, 4, 5))
                            .build());
                    assertThat(pages.get(1).getStatus()).isNull();
                    assertThat(pages.get(2).getCreatedAt()).isEqualTo(LocalDateTime.of(2026, 10, 19, 11, 55, 7));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should leave optional fields null when the table lacks their columns")
    void legacyTable() {
        DatabaseClient client = H2Databases.empty();
        H2Databases.execute(client,
                "CREATE TABLE tp_pages (id BIGINT PRIMARY KEY, title VARCHAR(255), slug VARCHAR(255), "
                        + "created_at TIMESTAMP, updated_at TIMESTAMP)",
                "INSERT INTO tp_pages (id, title, slug) VALUES (1, 'Home', 'home')");

        StepVerifier.create(new PageRepositoryImpl(client).findAllOrderById())
                .assertNext(page -> {
                    assertThat(page.getTitle()).isEqualTo("Home");
                    assertThat(page.getStatus()).isNull();
                    assertThat(page.getLayout()).isNull();
                    assertThat(page.getBlocks()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should export legacy pages without status, layout or blocks")
    void legacyTableExport() throws Exception {
        DatabaseClient client = H2Databases.empty();
        H2Databases.execute(client,
                "CREATE TABLE tp_pages (id BIGINT PRIMARY KEY, title VARCHAR(255), slug VARCHAR(255), "
                        + "created_at TIMESTAMP, updated_at TIMESTAMP)",
                "INSERT INTO tp_pages (id, title, slug, created_at) "
                        + "VALUES (1, 'Home', 'home', TIMESTAMP '2026-10-19 11:55:07')");
        ObjectMapper objectMapper = new ObjectMapper();
        PageExportCollector collector = new PageExportCollector(
                new SchemaRepositoryImpl(client), new PageRepositoryImpl(client), objectMapper);

        CollectorResult result = collector.collect().block();

        assertThat(result).isInstanceOf(CollectorResult.Collected.class);
        @SuppressWarnings("unchecked")
        RecordListDocument<PageExportData> document =
                (RecordListDocument<PageExportData>) ((CollectorResult.Collected) result).document();
        PageExportData page = document.getItems().get(0);
        assertThat(page.getCreatedAt()).isEqualTo("2026-10-19 11:55:07");
        assertThat(page.getStatus()).isNull();
        assertThat(page.getLayout()).isNull();
        assertThat(page.getBlocks()).isNull();
        assertThat(objectMapper.readTree(objectMapper.writeValueAsString(page)).fieldNames())
                .toIterable()
                .containsExactly("id", "title", "slug", "created_at", "updated_at");
    }
}
