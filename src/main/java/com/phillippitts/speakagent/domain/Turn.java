package com.phillippitts.speakagent.domain;

import java.util.Objects;

/**
 * One role-tagged utterance in the conversation history.
 *
 * @param role    who said it
 * @param content what was said (never null, may be empty)
 */
public record Turn(TurnRole role, String content) {

    public Turn {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
    }

    public static Turn user(String content) {
        return new Turn(TurnRole.USER, content);
    }

    public static Turn assistant(String content) {
        return new Turn(TurnRole.ASSISTANT, content);
    }
}
