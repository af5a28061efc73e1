package com.phillippitts.speakagent.service.session;

import com.phillippitts.speakagent.domain.DialogueSession;

import java.util.Optional;

/**
 * Keeps the committed state of each dialogue session.
 */
public interface DialogueSessionStore {

    Optional<DialogueSession> find(String sessionId);

    /** Inserts or replaces the session under its id. */
    void save(DialogueSession session);

    /** @return true if a session was removed */
    boolean remove(String sessionId);

    int size();
}
