package dev.tentapress.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of the pages plugin table.
 * {@code status}, {@code layout} and {@code blocks} are null when the installed schema predates them.
 */
@Table("tp_pages")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Page {

    @Id
    private Long id;

    private String title;

    private String slug;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    private String status;

    private String layout;

    /** Raw JSON text of the block list. */
    private String blocks;
}
