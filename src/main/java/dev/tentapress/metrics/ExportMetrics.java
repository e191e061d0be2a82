package dev.tentapress.metrics;

import dev.tentapress.service.collector.ExportDomain;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ExportMetrics {

    static final String ARCHIVES = "tentapress.export.archives";
    static final String DEGRADED_SECTIONS = "tentapress.export.sections.degraded";
    static final String DURATION = "tentapress.export.duration";

    private final MeterRegistry meterRegistry;

    private Counter successCounter;
    private Counter failureCounter;
    private Timer durationTimer;
    private final Map<ExportDomain, Counter> degradedCounters = new EnumMap<>(ExportDomain.class);

    @PostConstruct
    public void init() {
        successCounter = Counter.builder(ARCHIVES)
                .description("Export archives produced")
                .tag("outcome", "success")
                .register(meterRegistry);
        failureCounter = Counter.builder(ARCHIVES)
                .description("Export archives produced")
                .tag("outcome", "failure")
                .register(meterRegistry);
        durationTimer = Timer.builder(DURATION)
                .description("Time to assemble an export archive")
                .register(meterRegistry);

        // Pre-register one counter per domain so dashboards show zeroes
        for (ExportDomain domain : ExportDomain.values()) {
            degradedCounters.put(domain, Counter.builder(DEGRADED_SECTIONS)
                    .description("Sections written as placeholders or omitted because their source was unavailable")
                    .tag("domain", domain.key())
                    .register(meterRegistry));
        }
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordSuccess(Timer.Sample sample) {
        sample.stop(durationTimer);
        successCounter.increment();
    }

    public void recordFailure(Timer.Sample sample) {
        sample.stop(durationTimer);
        failureCounter.increment();
    }

    public void recordDegradedSection(ExportDomain domain) {
        degradedCounters.get(domain).increment();
    }
}
