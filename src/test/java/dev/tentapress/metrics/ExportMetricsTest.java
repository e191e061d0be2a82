package dev.tentapress.metrics;

import dev.tentapress.service.collector.ExportDomain;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExportMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private ExportMetrics exportMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        exportMetrics = new ExportMetrics(meterRegistry);
        exportMetrics.init();
    }

    @Test
    @DisplayName("Should pre-register one degraded-section counter per domain")
    void registersDomainCounters() {
        for (ExportDomain domain : ExportDomain.values()) {
            assertThat(meterRegistry.get(ExportMetrics.DEGRADED_SECTIONS).tag("domain", domain.key()).counter().count())
                    .isZero();
        }
    }

    @Test
    @DisplayName("Should count outcomes and time each export")
    void recordsOutcomes() {
        Timer.Sample first = exportMetrics.startTimer();
        exportMetrics.recordSuccess(first);
        Timer.Sample second = exportMetrics.startTimer();
        exportMetrics.recordFailure(second);

        assertThat(meterRegistry.get(ExportMetrics.ARCHIVES).tag("outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get(ExportMetrics.ARCHIVES).tag("outcome", "failure").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get(ExportMetrics.DURATION).timer().count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should count degraded sections per domain")
    void recordsDegradedSection() {
        exportMetrics.recordDegradedSection(ExportDomain.SEO);
        exportMetrics.recordDegradedSection(ExportDomain.SEO);

        assertThat(meterRegistry.get(ExportMetrics.DEGRADED_SECTIONS).tag("domain", "seo").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get(ExportMetrics.DEGRADED_SECTIONS).tag("domain", "pages").counter().count())
                .isZero();
    }
}
