package dev.tentapress.service.collector;

import dev.tentapress.dto.ExportOptions;

import java.util.function.Predicate;

/**
 * The data domains an archive can carry, in the order they are written.
 */
public enum ExportDomain {

    PAGES("pages", "pages.json", AbsencePolicy.WRITE_PLACEHOLDER, options -> true),
    SETTINGS("settings", "settings.json", AbsencePolicy.WRITE_PLACEHOLDER, ExportOptions::includeSettings),
    THEME("theme", "theme.json", AbsencePolicy.WRITE_PLACEHOLDER, ExportOptions::includeTheme),
    PLUGINS("plugins", "plugins.json", AbsencePolicy.WRITE_PLACEHOLDER, ExportOptions::includePlugins),
    SEO("seo", "seo.json", AbsencePolicy.OMIT, ExportOptions::includeSeo);

    /**
     * What the archive gets when a domain's collector reports it unavailable.
     */
    public enum AbsencePolicy {
        /** Write the collector's error-annotated placeholder document. */
        WRITE_PLACEHOLDER,
        /** Write nothing; the domain does not apply to this installation. */
        OMIT
    }

    private final String key;
    private final String entryName;
    private final AbsencePolicy absencePolicy;
    private final Predicate<ExportOptions> requested;

    ExportDomain(String key, String entryName, AbsencePolicy absencePolicy, Predicate<ExportOptions> requested) {
        this.key = key;
        this.entryName = entryName;
        this.absencePolicy = absencePolicy;
        this.requested = requested;
    }

    /** Key used in the manifest's {@code includes} map. */
    public String key() {
        return key;
    }

    /** Name of the archive entry this domain is written to. */
    public String entryName() {
        return entryName;
    }

    public AbsencePolicy absencePolicy() {
        return absencePolicy;
    }

    public boolean isRequested(ExportOptions options) {
        return requested.test(options);
    }
}
