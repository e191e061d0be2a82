package dev.tentapress.service.collector;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.tentapress.dto.PageExportData;
import dev.tentapress.dto.RecordListDocument;
import dev.tentapress.entity.Page;
import dev.tentapress.repository.PageRepository;
import dev.tentapress.repository.SchemaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PageExportCollectorTest {

    @Mock private SchemaRepository schemaRepository;
    @Mock private PageRepository pageRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private PageExportCollector collector;

    @BeforeEach
    void setUp() {
        collector = new PageExportCollector(schemaRepository, pageRepository, objectMapper);
    }

    private Page.PageBuilder page(long id) {
        return Page.builder()
                .id(id)
                .title("Page " + id)
                .slug("page-" + id)
                .createdAt(LocalDateTime.of(2026, 10, 19, 11, 55, 7))
                .updatedAt(LocalDateTime.of(2026, 10, 19, 12, 0, 0));
    }

    @Nested
    @DisplayName("collect")
    class Collect {

        @Test
        @DisplayName("Should report pages as unavailable when the table is missing")
        void missingTable() {
            when(schemaRepository.hasTable("tp_pages")).thenReturn(Mono.just(false));

            StepVerifier.create(collector.collect())
                    .assertNext(result -> assertThat(result)
                            .isEqualTo(CollectorResult.unavailable("Pages plugin not installed.")))
                    .verifyComplete();

            verifyNoInteractions(pageRepository);
        }

        @Test
        @DisplayName("Should export every page with the optional columns the schema defines")
        void exportsPages() {
            when(schemaRepository.hasTable("tp_pages")).thenReturn(Mono.just(true));
            when(schemaRepository.findColumnNames("tp_pages"))
                    .thenReturn(Flux.just("id", "title", "slug", "STATUS", "created_at", "updated_at"));
            when(pageRepository.findAllOrderById())
                    .thenReturn(Flux.just(page(1).status("published").build(), page(2).build()));

            StepVerifier.create(collector.collect())
                    .assertNext(result -> {
                        assertThat(result).isInstanceOf(CollectorResult.Collected.class);
                        @SuppressWarnings("unchecked")
                        RecordListDocument<PageExportData> document =
                                (RecordListDocument<PageExportData>) ((CollectorResult.Collected) result).document();
                        assertThat(document.getCount()).isEqualTo(2);
                        assertThat(document.getError()).isNull();
                        assertThat(document.getItems()).extracting(PageExportData::getId).containsExactly(1L, 2L);
                        assertThat(document.getItems()).extracting(PageExportData::getStatus)
                                .containsExactly("published", "");
                        assertThat(document.getItems()).extracting(PageExportData::getLayout)
                                .containsOnlyNulls();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should export an empty list when the table has no rows")
        void emptyTable() {
            when(schemaRepository.hasTable("tp_pages")).thenReturn(Mono.just(true));
            when(schemaRepository.findColumnNames("tp_pages")).thenReturn(Flux.just("id", "title", "slug"));
            when(pageRepository.findAllOrderById()).thenReturn(Flux.empty());

            StepVerifier.create(collector.collect())
                    .assertNext(result -> {
                        RecordListDocument<?> document =
                                (RecordListDocument<?>) ((CollectorResult.Collected) result).document();
                        assertThat(document.getCount()).isZero();
                        assertThat(document.getItems()).isEmpty();
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("toExportData")
    class ToExportData {

        @Test
        @DisplayName("Should format timestamps and omit optional fields the schema lacks")
        void baseColumnsOnly() {
            PageExportData data = collector.toExportData(page(7).status("draft").build(), PageSchema.of());

            assertThat(data.getId()).isEqualTo(7L);
            assertThat(data.getTitle()).isEqualTo("Page 7");
            assertThat(data.getSlug()).isEqualTo("page-7");
            assertThat(data.getCreatedAt()).isEqualTo("2026-10-19 11:55:07");
            assertThat(data.getUpdatedAt()).isEqualTo("2026-10-19 12:00:00");
            assertThat(data.getStatus()).isNull();
            assertThat(data.getLayout()).isNull();
            assertThat(data.getBlocks()).isNull();
        }

        @Test
        @DisplayName("Should substitute empty strings for null title, slug, status and layout")
        void nullsBecomeEmptyStrings() {
            Page page = Page.builder().id(3L).build();

            PageExportData data = collector.toExportData(page, PageSchema.of("status", "layout"));

            assertThat(data.getTitle()).isEmpty();
            assertThat(data.getSlug()).isEmpty();
            assertThat(data.getStatus()).isEmpty();
            assertThat(data.getLayout()).isEmpty();
            assertThat(data.getCreatedAt()).isNull();
        }

        @Test
        @DisplayName("Should keep blocks stored as a JSON array")
        void blocksArray() {
            Page page = page(1).blocks("[{\"type\":\"hero\",\"title\":\"Hi\"}]").build();

            PageExportData data = collector.toExportData(page, PageSchema.of("blocks"));

            assertThat(data.getBlocks().isArray()).isTrue();
            assertThat(data.getBlocks().get(0).get("type").asText()).isEqualTo("hero");
        }

        @Test
        @DisplayName("Should export malformed, scalar, object or null blocks as an empty array")
        void blocksFallback() {
            PageSchema schema = PageSchema.of("blocks");

            for (String raw : new String[]{"{not json", "42", "{\"type\":\"hero\"}", null, "  "}) {
                PageExportData data = collector.toExportData(page(1).blocks(raw).build(), schema);
                assertThat(data.getBlocks().isArray()).as("blocks for %s", raw).isTrue();
                assertThat(data.getBlocks()).as("blocks for %s", raw).isEmpty();
            }
        }
    }

    @Test
    @DisplayName("Should ignore unknown columns when resolving the page schema")
    void schemaIgnoresUnknownColumns() {
        PageSchema schema = PageSchema.fromColumns(List.of("id", "Layout", "excerpt"));

        assertThat(schema.optionalColumns()).containsExactly("layout");
        assertThat(schema.hasLayout()).isTrue();
        assertThat(schema.hasStatus()).isFalse();
    }
}
