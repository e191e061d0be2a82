package dev.tentapress.service.collector;

import dev.tentapress.dto.RecordListDocument;
import dev.tentapress.dto.SettingExportData;
import dev.tentapress.entity.Setting;
import dev.tentapress.repository.SchemaRepository;
import dev.tentapress.repository.SettingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Exports all settings rows, not just autoloaded ones, so the archive can rebuild the full store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettingsExportCollector implements DomainCollector {

    static final String SETTINGS_TABLE = "tp_settings";
    static final String NOT_FOUND = "Settings table tp_settings not found.";

    private final SchemaRepository schemaRepository;
    private final SettingRepository settingRepository;

    @Override
    public ExportDomain domain() {
        return ExportDomain.SETTINGS;
    }

    @Override
    public Mono<CollectorResult> collect() {
        return schemaRepository.hasTable(SETTINGS_TABLE)
                .flatMap(exists -> {
                    if (!Boolean.TRUE.equals(exists)) {
                        return Mono.just(CollectorResult.unavailable(NOT_FOUND));
                    }
                    return settingRepository.findAllOrderByKey()
                            .map(SettingsExportCollector::toExportData)
                            .collectList()
                            .doOnNext(items -> log.debug("Exporting {} settings", items.size()))
                            .map(items -> CollectorResult.collected(RecordListDocument.of(items)));
                });
    }

    static SettingExportData toExportData(Setting setting) {
        return new SettingExportData(
                setting.getKey() != null ? setting.getKey() : "",
                setting.getValue(),
                setting.getAutoload() == null || setting.getAutoload()
        );
    }
}
