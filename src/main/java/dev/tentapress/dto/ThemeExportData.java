package dev.tentapress.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"active_theme_id", "layouts", "error"})
public class ThemeExportData {
    private String activeThemeId;
    private List<String> layouts;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String error;

    public static ThemeExportData unavailable(String reason) {
        return new ThemeExportData(null, List.of(), reason);
    }
}
