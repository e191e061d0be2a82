package dev.tentapress.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Row-oriented export document: {@code {count, items}} when the domain was read,
 * {@code {error, items: []}} when its backing table or plugin is missing.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"error", "count", "items"})
public class RecordListDocument<T> {
    private String error;
    private Integer count;
    private List<T> items;

    public static <T> RecordListDocument<T> of(List<T> items) {
        return new RecordListDocument<>(null, items.size(), items);
    }

    public static <T> RecordListDocument<T> unavailable(String reason) {
        return new RecordListDocument<>(reason, null, List.of());
    }
}
