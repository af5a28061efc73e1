package com.phillippitts.speakagent.exception;

/**
 * Thrown when the classification service answered, but the answer cannot be interpreted
 * as an intent guess. The dialogue engine degrades this to a low-confidence general query.
 */
public class IntentParseException extends ClassificationException {

    private final String rawReply;

    public IntentParseException(String message, String rawReply) {
        super(message);
        this.rawReply = rawReply;
    }

    public IntentParseException(String message, String rawReply, Throwable cause) {
        super(message, cause);
        this.rawReply = rawReply;
    }

    public String getRawReply() {
        return rawReply;
    }
}
