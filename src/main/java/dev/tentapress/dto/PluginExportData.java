package dev.tentapress.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Enabled plugin ids. {@code cache_path} is reported even when the cache was missing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"enabled", "cache_path", "error"})
public class PluginExportData {
    private List<String> enabled;
    private String cachePath;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String error;

    public PluginExportData(List<String> enabled, String cachePath) {
        this(enabled, cachePath, null);
    }
}
