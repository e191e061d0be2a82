package dev.tentapress.service.collector;

/**
 * Outcome of collecting one domain: either a document to write, or the reason the
 * domain's backing storage or subsystem is not there. Absence is data, not an exception.
 */
public sealed interface CollectorResult permits CollectorResult.Collected, CollectorResult.Unavailable {

    static CollectorResult collected(Object document) {
        return new Collected(document);
    }

    static CollectorResult unavailable(String reason) {
        return new Unavailable(reason);
    }

    record Collected(Object document) implements CollectorResult {}

    record Unavailable(String reason) implements CollectorResult {}
}
