package dev.tentapress.dto;

/**
 * Inclusion flags for a single export run.
 * Pages are always exported and have no flag; every other domain is opt-out.
 */
public record ExportOptions(
        boolean includeSettings,
        boolean includeTheme,
        boolean includePlugins,
        boolean includeSeo
) {

    public static ExportOptions defaults() {
        return new ExportOptions(true, true, true, true);
    }

    /**
     * Build options from optional request values; an unset flag means "include".
     */
    public static ExportOptions of(Boolean includeSettings, Boolean includeTheme,
                                   Boolean includePlugins, Boolean includeSeo) {
        return new ExportOptions(
                includeSettings == null || includeSettings,
                includeTheme == null || includeTheme,
                includePlugins == null || includePlugins,
                includeSeo == null || includeSeo
        );
    }
}
