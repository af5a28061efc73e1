package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueSession;

/**
 * Advances a dialogue session by one user utterance.
 *
 * <p>Implementations never throw for failures of their collaborators: every failure path
 * still yields a non-empty reply.
 */
public interface DialogueEngine {

    /**
     * Processes one user utterance.
     *
     * @param session   current session state; not modified
     * @param utterance raw user text (may be null or blank)
     * @return the updated session with the reply to deliver
     */
    TurnReply processTurn(DialogueSession session, String utterance);
}
