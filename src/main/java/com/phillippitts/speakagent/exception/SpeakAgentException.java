package com.phillippitts.speakagent.exception;

/**
 * Base exception for all speakAgent application-specific errors.
 * Domain exceptions extend this class so the REST boundary can translate them in one place.
 */
public class SpeakAgentException extends RuntimeException {

    public SpeakAgentException(String message) {
        super(message);
    }

    public SpeakAgentException(String message, Throwable cause) {
        super(message, cause);
    }

    public SpeakAgentException(Throwable cause) {
        super(cause);
    }
}
