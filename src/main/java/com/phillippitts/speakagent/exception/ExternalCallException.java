package com.phillippitts.speakagent.exception;

/**
 * Thrown when a call into an external collaborator (classifier, contact lookup, skill,
 * phrase generator) cannot produce a result: it timed out, was interrupted, or the
 * collaborator is not available.
 */
public class ExternalCallException extends SpeakAgentException {

    private final String callName;

    public ExternalCallException(String message) {
        super(message);
        this.callName = "unknown";
    }

    public ExternalCallException(String message, String callName) {
        super(message + " (call: " + callName + ")");
        this.callName = callName;
    }

    public ExternalCallException(String message, String callName, Throwable cause) {
        super(message + " (call: " + callName + ")", cause);
        this.callName = callName;
    }

    public String getCallName() {
        return callName;
    }
}
