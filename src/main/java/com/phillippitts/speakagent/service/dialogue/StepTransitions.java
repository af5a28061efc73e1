package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueEvent;

/**
 * Which step runs after a step reported an event. Exhaustive over {@link DialogueEvent}.
 */
public final class StepTransitions {

    private StepTransitions() {
    }

    public static DialogueStep nextStep(DialogueEvent event) {
        return switch (event) {
            case INPUT_NORMALIZED -> DialogueStep.CLASSIFY;
            case INTENT_DETECTED -> DialogueStep.ROUTE;
            case ROUTED_TO_CANCEL -> DialogueStep.CANCEL;
            case ROUTED_TO_CONFIRM -> DialogueStep.CONFIRM;
            case ROUTED_TO_SLOT_CHECK -> DialogueStep.CHECK_SLOTS;
            case SLOTS_NEED_RESOLUTION -> DialogueStep.RESOLVE;
            case SLOTS_MISSING, DISAMBIGUATION_NEEDED -> DialogueStep.CLARIFY;
            case ROUTED_TO_SYSTEM_ACTION, SLOTS_COMPLETE, ENTITIES_RESOLVED, ACTION_CONFIRMED,
                 EXECUTION_STARTED -> DialogueStep.DISPATCH;
            case CLASSIFICATION_SKIPPED, CLASSIFICATION_FAILED, ROUTED_TO_REPLY, ACTION_SUCCEEDED,
                 ACTION_FAILED, TASK_CANCELLED, CLARIFICATION_REQUESTED, CLARIFICATIONS_EXHAUSTED,
                 STEP_FAILED -> DialogueStep.COMPOSE;
            case REPLY_COMPOSED -> DialogueStep.DONE;
        };
    }
}
