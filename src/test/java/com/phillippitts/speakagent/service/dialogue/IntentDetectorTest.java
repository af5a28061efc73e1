package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.IntentGuess;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.exception.ClassificationException;
import com.phillippitts.speakagent.exception.IntentParseException;
import com.phillippitts.speakagent.service.dialogue.event.ClassificationFailedEvent;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import com.phillippitts.speakagent.service.metrics.DialogueMetrics;
import com.phillippitts.speakagent.service.metrics.DialogueMetricsPublisher;
import com.phillippitts.speakagent.testutil.EventCapturingPublisher;
import com.phillippitts.speakagent.testutil.ScriptedClassifier;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentDetectorTest {

    private ScriptedClassifier classifier;
    private EventCapturingPublisher publisher;
    private SimpleMeterRegistry registry;
    private IntentDetector detector;

    @BeforeEach
    void setUp() {
        classifier = new ScriptedClassifier();
        publisher = new EventCapturingPublisher();
        registry = new SimpleMeterRegistry();
        detector = new IntentDetector(classifier, ExternalCallGuard.DIRECT, 2, publisher,
                new DialogueMetricsPublisher(new DialogueMetrics(registry)));
    }

    private static DialogueSession session(String input) {
        DialogueSession s = new DialogueSession("s-1", "o", 3);
        s.appendTurn(Turn.user("earlier"));
        s.appendTurn(Turn.assistant("reply"));
        s.appendTurn(Turn.user(input));
        s.setInputText(input);
        return s;
    }

    private double failures(String reason) {
        return registry.counter("speakagent.dialogue.classification.failure",
                "classifier", "scripted", "reason", reason).count();
    }

    @Test
    void storesGuessAndItsSlots() {
        classifier.then(IntentGuess.of(Intents.SET_TIMER, 0.9, Map.of("duration", "5 minutes")));
        DialogueSession s = session("timer for 5 minutes");

        assertThat(detector.detect(s)).isEqualTo(DialogueEvent.INTENT_DETECTED);
        assertThat(s.getIntentName()).isEqualTo(Intents.SET_TIMER);
        assertThat(s.getEntities()).containsEntry("duration", "5 minutes");
        assertThat(classifier.seenHistorySizes()).containsExactly(2);
        assertThat(publisher.eventsOf(ClassificationFailedEvent.class)).isEmpty();
    }

    @Test
    void newGuessReplacesPreviousSlots() {
        DialogueSession s = session("remind me");
        s.replaceEntities(Map.of("recipient", "mom"));
        classifier.then(IntentGuess.of(Intents.SET_REMINDER, 0.8, Map.of("reminder_text", "call")));

        detector.detect(s);

        assertThat(s.getEntities()).containsOnlyKeys("reminder_text");
    }

    @Test
    void blankInputSkipsClassifier() {
        DialogueSession s = session("   ");

        assertThat(detector.detect(s)).isEqualTo(DialogueEvent.CLASSIFICATION_SKIPPED);
        assertThat(s.getIntentName()).isEqualTo(Intents.UNKNOWN);
        assertThat(classifier.seenTexts()).isEmpty();
    }

    @Test
    void unparseableReplyBecomesLowConfidenceQuery() {
        classifier.thenThrow(new IntentParseException("not json", "garbage"));
        DialogueSession s = session("what is the capital of France");

        assertThat(detector.detect(s)).isEqualTo(DialogueEvent.INTENT_DETECTED);
        assertThat(s.getIntent().intent()).isEqualTo(Intents.GENERAL_QUERY);
        assertThat(s.getIntent().confidence()).isEqualTo(0.5);
        assertThat(s.getActionError()).isNull();
        assertThat(failures("parse")).isEqualTo(1.0);
        assertThat(publisher.eventsOf(ClassificationFailedEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.sessionId()).isEqualTo("s-1");
                    assertThat(e.reason()).isEqualTo("parse");
                });
    }

    @Test
    void serviceFailureIsClassificationFailed() {
        classifier.thenThrow(new ClassificationException("service unavailable"));
        DialogueSession s = session("text mom");

        assertThat(detector.detect(s)).isEqualTo(DialogueEvent.CLASSIFICATION_FAILED);
        assertThat(s.getIntentName()).isEqualTo(Intents.UNKNOWN);
        assertThat(s.getActionError()).isEqualTo("service unavailable");
        assertThat(failures("error")).isEqualTo(1.0);
    }

    @Test
    void rejectsEmptyHistoryWindow() {
        assertThatThrownBy(() -> new IntentDetector(classifier, ExternalCallGuard.DIRECT, 0, publisher,
                DialogueMetricsPublisher.NOOP))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
