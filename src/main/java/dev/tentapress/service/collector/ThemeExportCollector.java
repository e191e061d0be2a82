package dev.tentapress.service.collector;

import dev.tentapress.dto.ThemeExportData;
import dev.tentapress.service.theme.ActiveThemeProvider;
import dev.tentapress.service.theme.ThemeLayoutLister;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Exports the active theme id and its layouts through whichever theme capabilities are installed.
 * Each capability is optional; a capability that fails is skipped and the next one is tried.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ThemeExportCollector implements DomainCollector {

    static final String NOT_AVAILABLE = "Theme manager not available.";

    private final ObjectProvider<ActiveThemeProvider> activeThemeProviders;
    private final ObjectProvider<ThemeLayoutLister> layoutListers;

    @Override
    public ExportDomain domain() {
        return ExportDomain.THEME;
    }

    @Override
    public Mono<CollectorResult> collect() {
        // theme managers may read the filesystem
        return Mono.fromCallable(this::inspectTheme)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Object placeholder(String reason) {
        return ThemeExportData.unavailable(reason);
    }

    private CollectorResult inspectTheme() {
        List<ActiveThemeProvider> providers = activeThemeProviders.orderedStream().collect(Collectors.toList());
        List<ThemeLayoutLister> listers = layoutListers.orderedStream().collect(Collectors.toList());
        if (providers.isEmpty() && listers.isEmpty()) {
            return CollectorResult.unavailable(NOT_AVAILABLE);
        }

        String activeThemeId = providers.stream()
                .map(this::activeThemeId)
                .filter(id -> id != null && !id.isBlank())
                .findFirst()
                .orElse(null);

        List<String> layouts = listers.stream()
                .map(this::layouts)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(List.of());

        return CollectorResult.collected(new ThemeExportData(activeThemeId, layouts, null));
    }

    private String activeThemeId(ActiveThemeProvider provider) {
        try {
            return provider.activeThemeId();
        } catch (RuntimeException e) {
            log.warn("Active theme lookup failed in {}: {}", provider.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }

    private List<String> layouts(ThemeLayoutLister lister) {
        try {
            return lister.layouts();
        } catch (RuntimeException e) {
            log.warn("Layout listing failed in {}: {}", lister.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }
}
