package com.phillippitts.speakagent.service.events;

import com.phillippitts.speakagent.service.dialogue.event.ClassificationFailedEvent;
import com.phillippitts.speakagent.service.dialogue.event.SkillFailedEvent;
import com.phillippitts.speakagent.service.dialogue.event.TurnCompletedEvent;
import com.phillippitts.speakagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for dialogue failure events. Throttled per failure kind to avoid log spam
 * when a collaborator is down.
 */
@Component
class DialogueEventsListener {
    private static final Logger LOG = LogManager.getLogger(DialogueEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onClassificationFailed(ClassificationFailedEvent e) {
        String key = "classify-" + e.classifier() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Intent classification failing: classifier={}, reason={}, detail={}. "
                    + "Check llm.* properties and the model endpoint.", e.classifier(), e.reason(),
                    LogSanitizer.truncate(e.detail(), 200));
        }
    }

    @EventListener
    void onSkillFailed(SkillFailedEvent e) {
        String key = "skill-" + e.intent();
        if (shouldLog(key)) {
            LOG.warn("Skill failing: intent={}, error={}", e.intent(), LogSanitizer.truncate(e.error(), 200));
        }
    }

    @EventListener
    void onTurnCompleted(TurnCompletedEvent e) {
        LOG.debug("Turn completed: session={}, intent={}, status={}, {} ms",
                e.sessionId(), e.intent(), e.status(), e.elapsedMs());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
