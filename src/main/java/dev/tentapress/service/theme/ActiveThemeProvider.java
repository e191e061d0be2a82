package dev.tentapress.service.theme;

/**
 * Optional capability of the theme subsystem: reports which theme is active.
 */
@FunctionalInterface
public interface ActiveThemeProvider {

    /**
     * @return the active theme id, or {@code null} when no theme is active
     */
    String activeThemeId();
}
