package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class StepTransitionsTest {

    @Test
    void slotOutcomesBranch() {
        assertThat(StepTransitions.nextStep(DialogueEvent.SLOTS_MISSING)).isEqualTo(DialogueStep.CLARIFY);
        assertThat(StepTransitions.nextStep(DialogueEvent.SLOTS_NEED_RESOLUTION)).isEqualTo(DialogueStep.RESOLVE);
        assertThat(StepTransitions.nextStep(DialogueEvent.SLOTS_COMPLETE)).isEqualTo(DialogueStep.DISPATCH);
        assertThat(StepTransitions.nextStep(DialogueEvent.DISAMBIGUATION_NEEDED)).isEqualTo(DialogueStep.CLARIFY);
    }

    @Test
    void systemActionsSkipSlotNegotiation() {
        assertThat(StepTransitions.nextStep(DialogueEvent.ROUTED_TO_SYSTEM_ACTION)).isEqualTo(DialogueStep.DISPATCH);
    }

    @ParameterizedTest
    @EnumSource(value = DialogueEvent.class, names = {
            "CLASSIFICATION_SKIPPED", "CLASSIFICATION_FAILED", "ROUTED_TO_REPLY", "ACTION_SUCCEEDED",
            "ACTION_FAILED", "TASK_CANCELLED", "CLARIFICATION_REQUESTED", "CLARIFICATIONS_EXHAUSTED", "STEP_FAILED"})
    void turnEndingEventsGoToCompose(DialogueEvent event) {
        assertThat(StepTransitions.nextStep(event)).isEqualTo(DialogueStep.COMPOSE);
    }

    @Test
    void composingEndsTheTurn() {
        assertThat(StepTransitions.nextStep(DialogueEvent.REPLY_COMPOSED)).isEqualTo(DialogueStep.DONE);
    }

    @Test
    void noEventLeadsBackToNormalize() {
        for (DialogueEvent event : DialogueEvent.values()) {
            assertThat(StepTransitions.nextStep(event)).isNotEqualTo(DialogueStep.NORMALIZE);
        }
    }
}
