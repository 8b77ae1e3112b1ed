package com.di.chunkmutator.util;

import com.di.chunkmutator.mutation.MutationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics for segment pipelines and whole runs.
 * {@code path} is {@code fast} for uncompressed segments and {@code compressed} for pool tasks.
 */
@Slf4j
@Component
public class MutationMetrics {

    public static final String PATH_FAST       = "fast";
    public static final String PATH_COMPRESSED = "compressed";

    private final MeterRegistry meterRegistry;
    private final Timer         runTimer;

    public MutationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.runTimer = Timer.builder("chunkmutator.run.duration")
                .description("Wall time of one orchestration run")
                .register(meterRegistry);
    }

    public void recordSegment(String path, MutationResult result) {
        Counter.builder("chunkmutator.segments.total")
                .description("Segments processed")
                .tag("path", path)
                .tag("status", result.isSuccess() ? "success" : "failed")
                .register(meterRegistry)
                .increment(result.getSegmentCount());
        Counter.builder("chunkmutator.rows.affected")
                .description("Rows affected by mutation statements")
                .tag("path", path)
                .register(meterRegistry)
                .increment(result.getRowsAffected());
        if (result.getDuration() != null) {
            Timer.builder("chunkmutator.segment.duration")
                    .description("Per-segment pipeline time")
                    .tag("path", path)
                    .register(meterRegistry)
                    .record(result.getDuration());
        }
    }

    public void recordRun(Duration elapsed) {
        runTimer.record(elapsed);
    }

    public double segmentCount(String path, String status) {
        Counter c = meterRegistry.find("chunkmutator.segments.total").tag("path", path).tag("status", status).counter();
        return c == null ? 0.0 : c.count();
    }

    public double rowsAffected(String path) {
        Counter c = meterRegistry.find("chunkmutator.rows.affected").tag("path", path).counter();
        return c == null ? 0.0 : c.count();
    }

    public void logSummary() {
        log.info("[METRICS] segments fast ok={} failed={} | compressed ok={} failed={} | rows fast={} compressed={}",
                (long) segmentCount(PATH_FAST, "success"), (long) segmentCount(PATH_FAST, "failed"),
                (long) segmentCount(PATH_COMPRESSED, "success"), (long) segmentCount(PATH_COMPRESSED, "failed"),
                (long) rowsAffected(PATH_FAST), (long) rowsAffected(PATH_COMPRESSED));
    }
}
