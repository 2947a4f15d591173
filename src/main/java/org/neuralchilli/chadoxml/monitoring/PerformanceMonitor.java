package org.neuralchilli.chadoxml.monitoring;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Tracks how hard the object cache works and how long each pipeline stage takes.
 *
 * Tracks metrics for:
 * - materializations (from stored payloads and from placeholders)
 * - compressions, including those forced by the residency bound
 * - hits on already materialized handles
 * - per-stage wall time
 */
@ApplicationScoped
public class PerformanceMonitor {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    // Cache metrics
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder storedMaterializations = new LongAdder();
    private final LongAdder placeholderMaterializations = new LongAdder();
    private final LongAdder compressions = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder puts = new LongAdder();

    // Timing metrics
    private final Map<String, TimingStats> timingStats = new ConcurrentHashMap<>();

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordMaterialization(boolean fromPlaceholder) {
        if (fromPlaceholder) {
            placeholderMaterializations.increment();
        } else {
            storedMaterializations.increment();
        }
    }

    public void recordCompression() {
        compressions.increment();
    }

    /**
     * A compression forced by the residency bound rather than requested.
     */
    public void recordEviction() {
        evictions.increment();
    }

    public void recordPut() {
        puts.increment();
    }

    public long getMaterializations() {
        return storedMaterializations.sum() + placeholderMaterializations.sum();
    }

    public long getCompressions() {
        return compressions.sum();
    }

    public long getCacheHits() {
        return cacheHits.sum();
    }

    public long getEvictions() {
        return evictions.sum();
    }

    /**
     * Share of materialize calls answered without decoding anything.
     */
    public double getCacheHitRate() {
        long hits = cacheHits.sum();
        long total = hits + getMaterializations();
        return total > 0 ? (hits * 100.0) / total : 0.0;
    }

    /**
     * Start timing an operation.
     */
    public Timer startTimer(String operation) {
        return new Timer(operation);
    }

    /**
     * Timer for measuring one pipeline stage.
     */
    public class Timer implements AutoCloseable {
        private final String operation;
        private final Instant start;

        private Timer(String operation) {
            this.operation = operation;
            this.start = Instant.now();
        }

        public Duration stop() {
            Duration duration = Duration.between(start, Instant.now());
            timingStats.computeIfAbsent(operation, k -> new TimingStats())
                    .record(duration);
            return duration;
        }

        @Override
        public void close() {
            stop();
        }
    }

    public TimingStats getTimingStats(String operation) {
        return timingStats.get(operation);
    }

    /**
     * Statistics for one timed operation.
     */
    public static class TimingStats {
        private final AtomicLong count = new AtomicLong();
        private final AtomicLong totalNanos = new AtomicLong();
        private final AtomicLong maxNanos = new AtomicLong();

        void record(Duration duration) {
            long nanos = duration.toNanos();
            count.incrementAndGet();
            totalNanos.addAndGet(nanos);
            maxNanos.accumulateAndGet(nanos, Math::max);
        }

        public long getCount() {
            return count.get();
        }

        public Duration getTotal() {
            return Duration.ofNanos(totalNanos.get());
        }

        public Duration getMax() {
            return Duration.ofNanos(maxNanos.get());
        }

        @Override
        public String toString() {
            return String.format("count=%d, total=%dms, max=%dms",
                    getCount(), getTotal().toMillis(), getMax().toMillis());
        }
    }

    public PerformanceReport getReport() {
        return new PerformanceReport(
                getCacheHitRate(),
                cacheHits.sum(),
                storedMaterializations.sum(),
                placeholderMaterializations.sum(),
                compressions.sum(),
                evictions.sum(),
                puts.sum(),
                Map.copyOf(timingStats)
        );
    }

    /**
     * Performance report snapshot.
     */
    public record PerformanceReport(
            double cacheHitRate,
            long cacheHits,
            long storedMaterializations,
            long placeholderMaterializations,
            long compressions,
            long evictions,
            long puts,
            Map<String, TimingStats> stages
    ) {
        @Override
        public String toString() {
            StringBuilder stageLines = new StringBuilder();
            stages.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> stageLines.append("  ").append(e.getKey())
                            .append(": ").append(e.getValue()).append('\n'));

            return String.format("""
                Performance Report:
                ==================
                Object Cache:
                  Hit Rate: %.1f%% (%d hits)
                  Materialized: %d from store, %d placeholders
                  Compressed: %d (%d evictions)
                  Puts: %d

                Stages:
                %s""",
                    cacheHitRate, cacheHits,
                    storedMaterializations, placeholderMaterializations,
                    compressions, evictions,
                    puts,
                    stageLines
            );
        }
    }

    /**
     * Reset all metrics (useful for testing).
     */
    public void reset() {
        cacheHits.reset();
        storedMaterializations.reset();
        placeholderMaterializations.reset();
        compressions.reset();
        evictions.reset();
        puts.reset();
        timingStats.clear();
        log.debug("Performance metrics reset");
    }

    /**
     * Log current performance report.
     */
    public void logReport() {
        log.info("\n{}", getReport());
    }
}
