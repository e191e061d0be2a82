package dev.tentapress.service.theme;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Theme manager backed by the themes directory.
 * The active theme comes from configuration; its layouts are the files under
 * {@code <themes>/<active>/layouts}, named without extension.
 */
@Slf4j
public class FilesystemThemeManager implements ActiveThemeProvider, ThemeLayoutLister {

    private final String activeThemeId;
    private final Path themesRoot;

    public FilesystemThemeManager(String activeThemeId, Path themesRoot) {
        this.activeThemeId = activeThemeId;
        this.themesRoot = themesRoot;
        log.info("FilesystemThemeManager initialized: activeTheme={}, themesRoot={}", activeThemeId, themesRoot);
    }

    @Override
    public String activeThemeId() {
        return activeThemeId == null || activeThemeId.isBlank() ? null : activeThemeId;
    }

    @Override
    public List<String> layouts() {
        String themeId = activeThemeId();
        if (themeId == null) {
            return List.of();
        }
        Path layoutsDir = themesRoot.resolve(themeId).resolve("layouts").normalize();
        if (!layoutsDir.startsWith(themesRoot.normalize()) || !Files.isDirectory(layoutsDir)) {
            log.debug("No layouts directory for theme {}: {}", themeId, layoutsDir);
            return List.of();
        }
        try (Stream<Path> files = Files.list(layoutsDir)) {
            return files.filter(Files::isRegularFile)
                    .map(file -> layoutName(file.getFileName().toString()))
                    .filter(name -> !name.isEmpty())
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list layouts in " + layoutsDir, e);
        }
    }

    // page.blade.php -> page
    private static String layoutName(String filename) {
        int dot = filename.indexOf('.');
        return dot >= 0 ? filename.substring(0, dot) : filename;
    }
}
