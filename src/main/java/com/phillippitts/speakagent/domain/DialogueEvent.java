package com.phillippitts.speakagent.domain;

/**
 * Outcome reported by a dialogue step. Events are the only way the task status changes;
 * see {@link TaskStatusTransitions}.
 */
public enum DialogueEvent {
    INPUT_NORMALIZED,
    INTENT_DETECTED,
    CLASSIFICATION_SKIPPED,
    CLASSIFICATION_FAILED,
    ROUTED_TO_CANCEL,
    ROUTED_TO_CONFIRM,
    ROUTED_TO_SYSTEM_ACTION,
    ROUTED_TO_REPLY,
    ROUTED_TO_SLOT_CHECK,
    SLOTS_MISSING,
    SLOTS_NEED_RESOLUTION,
    SLOTS_COMPLETE,
    ENTITIES_RESOLVED,
    DISAMBIGUATION_NEEDED,
    EXECUTION_STARTED,
    ACTION_SUCCEEDED,
    ACTION_FAILED,
    TASK_CANCELLED,
    ACTION_CONFIRMED,
    CLARIFICATION_REQUESTED,
    CLARIFICATIONS_EXHAUSTED,
    REPLY_COMPOSED,
    /** A step failed unexpectedly; the turn still gets a reply. */
    STEP_FAILED
}
