package com.phillippitts.speakagent.service.dialogue;

/**
 * Units of work the engine sequences within one turn.
 */
public enum DialogueStep {
    NORMALIZE,
    CLASSIFY,
    ROUTE,
    CHECK_SLOTS,
    RESOLVE,
    CLARIFY,
    DISPATCH,
    CANCEL,
    CONFIRM,
    COMPOSE,
    DONE
}
