package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueSession;

import java.util.Objects;

/**
 * Result of one turn.
 *
 * @param session     the session after the turn; the caller's instance is left untouched
 * @param replyText   text to show or speak, never empty
 * @param shouldSpeak whether the reply should be read aloud
 */
public record TurnReply(DialogueSession session, String replyText, boolean shouldSpeak) {

    public TurnReply {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(replyText, "replyText must not be null");
    }
}
