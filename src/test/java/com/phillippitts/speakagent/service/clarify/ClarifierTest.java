package com.phillippitts.speakagent.service.clarify;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.DisambiguationOption;
import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.domain.TurnRole;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import com.phillippitts.speakagent.service.metrics.DialogueMetrics;
import com.phillippitts.speakagent.service.metrics.DialogueMetricsPublisher;
import com.phillippitts.speakagent.testutil.StubPhraseGenerator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClarifierTest {

    private SimpleMeterRegistry registry;
    private DialogueMetricsPublisher metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DialogueMetricsPublisher(new DialogueMetrics(registry));
    }

    private Clarifier clarifier(StubPhraseGenerator phrases) {
        return new Clarifier(phrases, ExternalCallGuard.DIRECT, metrics);
    }

    private static DialogueSession session(int max, String... missing) {
        DialogueSession s = new DialogueSession("s", "o", max);
        s.setInputLanguage(Language.EN);
        s.setMissingEntities(List.of(missing));
        return s;
    }

    @Test
    void asksCannedQuestionForFirstMissingSlot() {
        StubPhraseGenerator phrases = new StubPhraseGenerator("generated?", "reply");
        DialogueSession s = session(3, "message_content", "recipient");

        assertThat(clarifier(phrases).clarify(s)).isEqualTo(DialogueEvent.CLARIFICATION_REQUESTED);
        assertThat(s.getResponseText()).isEqualTo("What should the message say?");
        assertThat(s.isShouldSpeak()).isTrue();
        assertThat(s.getClarificationCount()).isEqualTo(1);
        assertThat(s.getTurns()).singleElement().satisfies(t -> assertThat(t.role()).isEqualTo(TurnRole.ASSISTANT));
        assertThat(phrases.calls()).isZero();
        assertThat(registry.counter("speakagent.dialogue.clarification", "outcome", "asked").count()).isEqualTo(1.0);
    }

    @Test
    void disambiguationPromptTakesPriority() {
        DialogueSession s = session(3, "message_content");
        s.addDisambiguationOption(new DisambiguationOption("recipient", "ana", List.of(), "Which Ana?"));

        clarifier(StubPhraseGenerator.failing()).clarify(s);

        assertThat(s.getResponseText()).isEqualTo("Which Ana?");
    }

    @Test
    void generatesQuestionForSlotWithoutCannedOne() {
        DialogueSession s = session(3, "recurrence");

        clarifier(new StubPhraseGenerator("  How often should it repeat?  ", null)).clarify(s);

        assertThat(s.getResponseText()).isEqualTo("How often should it repeat?");
    }

    @Test
    void fallsBackWhenGenerationFails() {
        DialogueSession s = session(3, "recurrence");

        clarifier(StubPhraseGenerator.failing()).clarify(s);

        assertThat(s.getResponseText()).isEqualTo("Could you give me more information about recurrence?");
    }

    @Test
    void exhaustedBudgetAsksToStartOver() {
        DialogueSession s = session(1, "message_content");
        s.incrementClarificationCount();

        assertThat(clarifier(StubPhraseGenerator.failing()).clarify(s))
                .isEqualTo(DialogueEvent.CLARIFICATIONS_EXHAUSTED);
        assertThat(s.getResponseText()).startsWith("Looks like we're having trouble");
        assertThat(s.getClarificationCount()).isEqualTo(1);
        assertThat(registry.counter("speakagent.dialogue.clarification", "outcome", "exhausted").count())
                .isEqualTo(1.0);
    }

    @Test
    void zeroBudgetNeverAsks() {
        DialogueSession s = session(0, "duration");

        assertThat(clarifier(StubPhraseGenerator.failing()).clarify(s))
                .isEqualTo(DialogueEvent.CLARIFICATIONS_EXHAUSTED);
    }
}
