package com.phillippitts.speakagent.exception;

/**
 * Thrown when a turn or lookup references a session that does not exist (or has ended).
 */
public class SessionNotFoundException extends SpeakAgentException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
