package org.neuralchilli.chadoxml.monitoring;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PerformanceMonitorTest {

    @Test
    void shouldComputeHitRateOverMaterializeCalls() {
        PerformanceMonitor monitor = new PerformanceMonitor();

        monitor.recordCacheHit();
        monitor.recordCacheHit();
        monitor.recordCacheHit();
        monitor.recordMaterialization(false);

        assertThat(monitor.getCacheHitRate()).isEqualTo(75.0);
        assertThat(monitor.getMaterializations()).isEqualTo(1);
    }

    @Test
    void shouldTimeStages() {
        PerformanceMonitor monitor = new PerformanceMonitor();

        try (PerformanceMonitor.Timer timer = monitor.startTimer("write")) {
            assertThat(timer).isNotNull();
        }
        Duration second = monitor.startTimer("write").stop();

        PerformanceMonitor.TimingStats stats = monitor.getTimingStats("write");
        assertThat(stats.getCount()).isEqualTo(2);
        assertThat(stats.getMax()).isGreaterThanOrEqualTo(second);
        assertThat(monitor.getReport().toString()).contains("write: count=2");
    }

    @Test
    void shouldResetEverything() {
        PerformanceMonitor monitor = new PerformanceMonitor();
        monitor.recordCompression();
        monitor.recordEviction();
        monitor.startTimer("parse").stop();

        monitor.reset();

        assertThat(monitor.getCompressions()).isZero();
        assertThat(monitor.getEvictions()).isZero();
        assertThat(monitor.getTimingStats("parse")).isNull();
        assertThat(monitor.getCacheHitRate()).isZero();
    }
}
