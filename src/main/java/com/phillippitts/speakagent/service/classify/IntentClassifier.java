package com.phillippitts.speakagent.service.classify;

import com.phillippitts.speakagent.domain.IntentGuess;
import com.phillippitts.speakagent.domain.Turn;

import java.util.List;

/**
 * Turns the latest utterance, in the context of recent turns, into a structured intent guess.
 *
 * <p>Implementations may block on network I/O and may fail:
 * <ul>
 *   <li>{@link com.phillippitts.speakagent.exception.IntentParseException} when the service
 *       answered with something that is not an intent guess</li>
 *   <li>any other runtime exception when the service could not be reached or errored</li>
 * </ul>
 * The dialogue engine converts both into a degraded guess; neither ends the turn.
 */
public interface IntentClassifier {

    /**
     * @param history most recent turns, oldest first, possibly ending with the current utterance
     * @param text    latest normalized user input, never blank
     * @return guess with an intent from {@link com.phillippitts.speakagent.domain.Intents#ALL}
     */
    IntentGuess classify(List<Turn> history, String text);

    /** Short name for logs and metrics. */
    String name();
}
