package com.phillippitts.speakagent.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link DialogueMetrics} used by the dialogue steps.
 *
 * <p>Unit tests use {@link #NOOP} so steps can run without a meter registry.
 */
@Component
public final class DialogueMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(DialogueMetricsPublisher.class);

    /**
     * Singleton no-op instance for tests.
     */
    public static final DialogueMetricsPublisher NOOP = new DialogueMetricsPublisher(null);

    private final DialogueMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable for test mode)
     */
    public DialogueMetricsPublisher(DialogueMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("DialogueMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordTurn(String finalStatus, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.recordTurnLatency(finalStatus, durationNanos);
    }

    public void recordClassificationFailure(String classifier, String reason) {
        if (metrics == null) {
            return;
        }
        metrics.incrementClassificationFailure(classifier, reason);
    }

    public void recordDispatch(String intent, String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.incrementDispatch(intent, outcome);
    }

    public void recordClarification(String outcome) {
        if (metrics == null) {
            return;
        }
        metrics.incrementClarification(outcome);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
