package com.phillippitts.speakagent.exception;

/**
 * Thrown when the intent classification service fails to produce a guess.
 */
public class ClassificationException extends SpeakAgentException {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
