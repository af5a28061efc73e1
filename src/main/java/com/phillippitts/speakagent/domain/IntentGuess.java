package com.phillippitts.speakagent.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured result of classifying one utterance.
 *
 * <p>A guess is replaced wholesale on each new utterance and never merged with the previous one.
 *
 * @param intent     intent name, one of {@link Intents#ALL}
 * @param confidence classifier confidence between 0.0 and 1.0
 * @param slots      slot name to raw (unvalidated) value, insertion ordered
 * @param missing    slot names the classifier itself flagged as missing
 * @param reasoning  free-text explanation from the classifier, may be empty
 */
public record IntentGuess(
        String intent,
        double confidence,
        Map<String, String> slots,
        List<String> missing,
        String reasoning
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException if confidence is out of range
     * @throws NullPointerException if intent is null
     */
    public IntentGuess {
        Objects.requireNonNull(intent, "Intent must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        slots = slots == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(slots));
        missing = missing == null ? List.of() : List.copyOf(missing);
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static IntentGuess of(String intent, double confidence, Map<String, String> slots) {
        return new IntentGuess(intent, confidence, slots, List.of(), "");
    }

    /** Zero-confidence guess used when there is nothing to classify or classification failed. */
    public static IntentGuess unknown() {
        return new IntentGuess(Intents.UNKNOWN, 0.0, Map.of(), List.of(), "");
    }

    /** Low-confidence fallback used when the classifier reply could not be interpreted. */
    public static IntentGuess lowConfidenceQuery(String reasoning) {
        return new IntentGuess(Intents.GENERAL_QUERY, 0.5, Map.of(), List.of(), reasoning);
    }
}
