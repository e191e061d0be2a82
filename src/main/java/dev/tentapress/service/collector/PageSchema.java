package dev.tentapress.service.collector;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The optional page columns the installed schema currently defines.
 * Later versions of the pages plugin added {@code status}, {@code layout} and {@code blocks}.
 */
public record PageSchema(Set<String> optionalColumns) {

    public static final String STATUS = "status";
    public static final String LAYOUT = "layout";
    public static final String BLOCKS = "blocks";

    private static final Set<String> KNOWN_OPTIONAL = Set.of(STATUS, LAYOUT, BLOCKS);

    public PageSchema {
        optionalColumns = Set.copyOf(optionalColumns);
    }

    public static PageSchema fromColumns(Collection<String> columns) {
        return new PageSchema(columns.stream()
                .map(column -> column.toLowerCase(Locale.ROOT))
                .filter(KNOWN_OPTIONAL::contains)
                .collect(Collectors.toSet()));
    }

    public static PageSchema of(String... optionalColumns) {
        return fromColumns(Set.of(optionalColumns));
    }

    public boolean hasStatus() {
        return optionalColumns.contains(STATUS);
    }

    public boolean hasLayout() {
        return optionalColumns.contains(LAYOUT);
    }

    public boolean hasBlocks() {
        return optionalColumns.contains(BLOCKS);
    }
}
