package com.phillippitts.speakagent.domain;

/**
 * Speaker of a {@link Turn}.
 */
public enum TurnRole {
    USER,
    ASSISTANT,
    SYSTEM
}
