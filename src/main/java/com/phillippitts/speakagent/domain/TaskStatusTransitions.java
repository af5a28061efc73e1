package com.phillippitts.speakagent.domain;

/**
 * Transition function of the task-status state machine: {@code (status, event) -> status}.
 *
 * <p>Routing and bookkeeping events keep the current status; every other event moves the
 * session to a fixed status. The switch is exhaustive, so adding an event without deciding
 * its effect does not compile.
 */
public final class TaskStatusTransitions {

    private TaskStatusTransitions() {
    }

    public static TaskStatus next(TaskStatus current, DialogueEvent event) {
        return switch (event) {
            case INPUT_NORMALIZED, ROUTED_TO_CANCEL, ROUTED_TO_CONFIRM, ROUTED_TO_SYSTEM_ACTION,
                 ROUTED_TO_REPLY, ROUTED_TO_SLOT_CHECK, REPLY_COMPOSED -> current;
            case INTENT_DETECTED -> TaskStatus.INTENT_DETECTED;
            case CLASSIFICATION_SKIPPED -> TaskStatus.IDLE;
            case CLASSIFICATION_FAILED, ACTION_FAILED, STEP_FAILED -> TaskStatus.FAILED;
            case SLOTS_MISSING, SLOTS_NEED_RESOLUTION, DISAMBIGUATION_NEEDED -> TaskStatus.NEEDS_CLARIFICATION;
            case SLOTS_COMPLETE, ENTITIES_RESOLVED, ACTION_CONFIRMED -> TaskStatus.READY_TO_EXECUTE;
            case EXECUTION_STARTED -> TaskStatus.EXECUTING;
            case ACTION_SUCCEEDED -> TaskStatus.COMPLETED;
            case TASK_CANCELLED, CLARIFICATIONS_EXHAUSTED -> TaskStatus.CANCELLED;
            case CLARIFICATION_REQUESTED -> TaskStatus.WAITING_USER_INPUT;
        };
    }
}
