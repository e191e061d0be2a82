package dev.tentapress.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-page SEO metadata. Unset fields are exported as {@code null}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SeoExportData {
    private long pageId;
    private String title;
    private String description;
    private String canonicalUrl;
    private String robots;
    private String ogTitle;
    private String ogDescription;
    private String ogImage;
    private String twitterTitle;
    private String twitterDescription;
    private String twitterImage;
}
