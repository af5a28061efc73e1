package com.phillippitts.speakagent.domain;

/**
 * Progress of the task negotiated in a dialogue session.
 *
 * <p>{@link #WAITING_USER_INPUT}, {@link #COMPLETED}, {@link #FAILED} and {@link #CANCELLED}
 * end the current turn: once one of them is reached the engine only composes the reply.
 * The remaining states are intermediate and always advance within the same turn.
 */
public enum TaskStatus {
    IDLE(false),
    INTENT_DETECTED(false),
    NEEDS_CLARIFICATION(false),
    WAITING_USER_INPUT(true),
    READY_TO_EXECUTE(false),
    EXECUTING(false),
    COMPLETED(true),
    FAILED(true),
    CANCELLED(true);

    private final boolean terminalForTurn;

    TaskStatus(boolean terminalForTurn) {
        this.terminalForTurn = terminalForTurn;
    }

    public boolean isTerminalForTurn() {
        return terminalForTurn;
    }
}
