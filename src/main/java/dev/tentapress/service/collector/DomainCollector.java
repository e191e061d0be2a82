package dev.tentapress.service.collector;

import dev.tentapress.dto.RecordListDocument;
import reactor.core.publisher.Mono;

/**
 * Reads one export domain into a JSON-serializable document.
 * Implementations report a missing table or subsystem as {@link CollectorResult.Unavailable}
 * instead of failing; only unexpected faults surface as errors.
 */
public interface DomainCollector {

    ExportDomain domain();

    Mono<CollectorResult> collect();

    /**
     * Document written in place of the real one when the domain is unavailable.
     */
    default Object placeholder(String reason) {
        return RecordListDocument.unavailable(reason);
    }
}
