package com.phillippitts.speakagent.service.session;

import com.phillippitts.speakagent.domain.DialogueSession;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local session store. State is lost on restart.
 */
public class InMemoryDialogueSessionStore implements DialogueSessionStore {

    private final ConcurrentMap<String, DialogueSession> sessions = new ConcurrentHashMap<>();

    @Override
    public Optional<DialogueSession> find(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public void save(DialogueSession session) {
        Objects.requireNonNull(session, "session must not be null");
        sessions.put(session.getSessionId(), session);
    }

    @Override
    public boolean remove(String sessionId) {
        return sessionId != null && sessions.remove(sessionId) != null;
    }

    @Override
    public int size() {
        return sessions.size();
    }
}
