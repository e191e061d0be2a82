package dev.tentapress.service.theme;

import java.util.List;

/**
 * Optional capability of the theme subsystem: lists the layouts the active theme offers.
 */
@FunctionalInterface
public interface ThemeLayoutLister {

    List<String> layouts();
}
