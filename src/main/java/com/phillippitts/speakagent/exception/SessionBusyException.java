package com.phillippitts.speakagent.exception;

/**
 * Thrown when a new utterance arrives for a session while a previous turn of the same
 * session is still being processed and the lock could not be acquired in time.
 */
public class SessionBusyException extends SpeakAgentException {

    private final String sessionId;
    private final long waitedMs;

    public SessionBusyException(String sessionId, long waitedMs) {
        super("Session " + sessionId + " is busy processing another turn (waited " + waitedMs + "ms)");
        this.sessionId = sessionId;
        this.waitedMs = waitedMs;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
