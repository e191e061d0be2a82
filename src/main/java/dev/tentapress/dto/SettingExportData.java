package dev.tentapress.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the key/value settings store.
 */
@JsonPropertyOrder({"key", "value", "autoload"})
public record SettingExportData(
        String key,
        String value,
        boolean autoload
) {}
