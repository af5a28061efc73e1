package com.phillippitts.speakagent.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for dialogue turns.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Turn latency by final task status</li>
 *   <li>Classification failures by classifier and reason</li>
 *   <li>Dispatch outcomes per intent</li>
 *   <li>Clarifying questions asked and budgets exhausted</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class DialogueMetrics {

    private static final String METRIC_PREFIX = "speakagent.dialogue";

    private final MeterRegistry registry;

    public DialogueMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTurnLatency(String finalStatus, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".turn.latency")
                .description("Time taken to process one dialogue turn")
                .tag("status", finalStatus)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementClassificationFailure(String classifier, String reason) {
        Counter.builder(METRIC_PREFIX + ".classification.failure")
                .description("Number of utterances the classifier could not classify")
                .tag("classifier", classifier)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome {@code success}, {@code failure} or {@code no_handler}
     */
    public void incrementDispatch(String intent, String outcome) {
        Counter.builder(METRIC_PREFIX + ".dispatch")
                .description("Number of dispatched actions by intent and outcome")
                .tag("intent", intent)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome {@code asked} or {@code exhausted}
     */
    public void incrementClarification(String outcome) {
        Counter.builder(METRIC_PREFIX + ".clarification")
                .description("Number of clarifying questions asked or abandoned")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
