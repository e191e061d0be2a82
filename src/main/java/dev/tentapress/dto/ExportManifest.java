package dev.tentapress.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Summary written last into every archive as {@code manifest.json}.
 * {@code includes} records what the archive actually contains, keyed by domain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"schema_version", "generated_at_utc", "app", "includes"})
public class ExportManifest {
    private int schemaVersion;
    private String generatedAtUtc;
    private AppInfo app;
    private Map<String, Boolean> includes;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AppInfo {
        private String name;
    }
}
