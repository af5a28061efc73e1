package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.IntentGuess;
import com.phillippitts.speakagent.exception.IntentParseException;
import com.phillippitts.speakagent.service.classify.IntentClassifier;
import com.phillippitts.speakagent.service.dialogue.event.ClassificationFailedEvent;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import com.phillippitts.speakagent.service.metrics.DialogueMetricsPublisher;
import com.phillippitts.speakagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;

/**
 * Classify step: asks the {@link IntentClassifier} for a guess and stores it on the session.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>empty input: classification is skipped, the guess is {@code unknown}, status {@code IDLE}</li>
 *   <li>unparseable reply: a low-confidence {@code general_query} guess, the turn goes on</li>
 *   <li>any other failure: an {@code unknown} guess, the error on the action error, status {@code FAILED}</li>
 * </ul>
 * Slot values are replaced by those of the new guess in every case.
 */
public class IntentDetector {
    private static final Logger LOG = LogManager.getLogger(IntentDetector.class);

    private final IntentClassifier classifier;
    private final ExternalCallGuard guard;
    private final int historyWindow;
    private final ApplicationEventPublisher publisher;
    private final DialogueMetricsPublisher metrics;

    public IntentDetector(IntentClassifier classifier,
                          ExternalCallGuard guard,
                          int historyWindow,
                          ApplicationEventPublisher publisher,
                          DialogueMetricsPublisher metrics) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.guard = Objects.requireNonNull(guard, "guard");
        if (historyWindow < 1) {
            throw new IllegalArgumentException("historyWindow must be >= 1, got: " + historyWindow);
        }
        this.historyWindow = historyWindow;
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public DialogueEvent detect(DialogueSession session) {
        String text = session.getInputText();
        if (text == null || text.isBlank()) {
            adopt(session, IntentGuess.unknown());
            return DialogueEvent.CLASSIFICATION_SKIPPED;
        }
        try {
            IntentGuess guess = guard.call("classify",
                    () -> classifier.classify(session.recentTurns(historyWindow), text));
            if (guess == null) {
                throw new IntentParseException("Classifier returned no guess", null);
            }
            adopt(session, guess);
            LOG.debug("Intent {} (confidence={}) for {}", guess.intent(), guess.confidence(),
                    LogSanitizer.preview(text, LogSanitizer.DEFAULT_PREVIEW));
            return DialogueEvent.INTENT_DETECTED;
        } catch (IntentParseException e) {
            LOG.warn("Classifier reply could not be parsed ({}); treating as general query", e.getMessage());
            failed(session, "parse", e.getMessage());
            adopt(session, IntentGuess.lowConfidenceQuery("unparseable classifier reply"));
            return DialogueEvent.INTENT_DETECTED;
        } catch (RuntimeException e) {
            LOG.warn("Classification failed: {}", e.getMessage());
            failed(session, "error", e.getMessage());
            adopt(session, IntentGuess.unknown());
            session.setActionError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            return DialogueEvent.CLASSIFICATION_FAILED;
        }
    }

    private static void adopt(DialogueSession session, IntentGuess guess) {
        session.setIntent(guess);
        session.replaceEntities(guess.slots());
    }

    private void failed(DialogueSession session, String reason, String detail) {
        metrics.recordClassificationFailure(classifier.name(), reason);
        publisher.publishEvent(new ClassificationFailedEvent(session.getSessionId(), classifier.name(), reason,
                detail, Instant.now()));
    }
}
