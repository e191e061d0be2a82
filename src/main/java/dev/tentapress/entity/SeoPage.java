package dev.tentapress.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table("tp_seo_pages")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeoPage {

    @Column("page_id")
    private Long pageId;

    private String title;

    private String description;

    @Column("canonical_url")
    private String canonicalUrl;

    private String robots;

    @Column("og_title")
    private String ogTitle;

    @Column("og_description")
    private String ogDescription;

    @Column("og_image")
    private String ogImage;

    @Column("twitter_title")
    private String twitterTitle;

    @Column("twitter_description")
    private String twitterDescription;

    @Column("twitter_image")
    private String twitterImage;
}
