package com.smurthy.ai.derma.observability;

import com.smurthy.ai.derma.agents.Intent;
import com.smurthy.ai.derma.orchestration.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Routing Observability Metrics
 *
 * Tracks how turns are routed and how they end:
 * - turns per intent
 * - fallback dispatches and degraded bundles
 * - failures per reason
 * - end-to-end turn latency
 *
 * Exposed on {@code /monitoring/routing}.
 */
public class RoutingMetrics {

    private static final Logger log = LoggerFactory.getLogger(RoutingMetrics.class);

    private static final long SLOW_TURN_MS = 10_000;

    private final Map<Intent, LongAdder> turnsByIntent = new EnumMap<>(Intent.class);
    private final Map<FailureReason, LongAdder> failuresByReason = new EnumMap<>(FailureReason.class);
    private final LongAdder completedTurns = new LongAdder();
    private final LongAdder fallbacks = new LongAdder();
    private final LongAdder degradedBundles = new LongAdder();
    private final LongAdder noEvidenceAnswers = new LongAdder();

    private final LongAdder totalLatencyMs = new LongAdder();
    private final AtomicLong maxLatencyMs = new AtomicLong(0);

    public RoutingMetrics() {
        for (Intent intent : Intent.values()) {
            turnsByIntent.put(intent, new LongAdder());
        }
        for (FailureReason reason : FailureReason.values()) {
            failuresByReason.put(reason, new LongAdder());
        }
    }

    public void recordCompletedTurn(Intent intent, boolean degraded, boolean fallbackTriggered,
                                    boolean grounded, long latencyMs) {
        completedTurns.increment();
        turnsByIntent.get(intent).increment();
        if (degraded) {
            degradedBundles.increment();
        }
        if (fallbackTriggered) {
            fallbacks.increment();
        }
        if (!grounded) {
            noEvidenceAnswers.increment();
        }
        totalLatencyMs.add(latencyMs);
        maxLatencyMs.accumulateAndGet(latencyMs, Math::max);

        if (latencyMs > SLOW_TURN_MS) {
            log.warn("Slow turn detected: {}ms for {} query", latencyMs, intent.label());
        }
    }

    public void recordFailure(FailureReason reason) {
        failuresByReason.get(reason).increment();
    }

    public MetricsSummary getMetricsSummary() {
        long turns = completedTurns.sum();
        Map<String, Long> intents = new LinkedHashMap<>();
        turnsByIntent.forEach((intent, count) -> intents.put(intent.label(), count.sum()));
        Map<String, Long> failures = new LinkedHashMap<>();
        failuresByReason.forEach((reason, count) -> failures.put(reason.name(), count.sum()));

        return new MetricsSummary(
                turns,
                intents,
                fallbacks.sum(),
                degradedBundles.sum(),
                noEvidenceAnswers.sum(),
                failures,
                turns > 0 ? totalLatencyMs.sum() / turns : 0,
                maxLatencyMs.get()
        );
    }

    public void resetMetrics() {
        turnsByIntent.values().forEach(LongAdder::reset);
        failuresByReason.values().forEach(LongAdder::reset);
        completedTurns.reset();
        fallbacks.reset();
        degradedBundles.reset();
        noEvidenceAnswers.reset();
        totalLatencyMs.reset();
        maxLatencyMs.set(0);
        log.info("Routing metrics reset");
    }

    public record MetricsSummary(
            long completedTurns,
            Map<String, Long> turnsByIntent,
            long fallbacks,
            long degradedBundles,
            long noEvidenceAnswers,
            Map<String, Long> failuresByReason,
            long avgLatencyMs,
            long maxLatencyMs
    ) {}
}
