package dev.tentapress.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One exported page.
 * {@code status}, {@code layout} and {@code blocks} are only present when the
 * pages table defines the matching column; the collector never leaves them null otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"id", "title", "slug", "created_at", "updated_at", "status", "layout", "blocks"})
public class PageExportData {
    private long id;
    private String title;
    private String slug;
    private String createdAt;
    private String updatedAt;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String status;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String layout;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private JsonNode blocks;
}
