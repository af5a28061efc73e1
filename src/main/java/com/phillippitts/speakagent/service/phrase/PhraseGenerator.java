package com.phillippitts.speakagent.service.phrase;

import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.domain.Turn;

import java.util.List;
import java.util.Map;

/**
 * Produces free-form assistant text that the fixed phrase tables cannot provide.
 *
 * <p>Both operations may block on network I/O and may throw; callers fall back to canned text.
 */
public interface PhraseGenerator {

    /**
     * Phrases one short question asking for {@code missingSlot}.
     *
     * @param intent      intent being negotiated
     * @param knownSlots  slot values already provided
     * @param missingSlot slot to ask about
     * @param language    language to answer in
     * @return the question, never blank
     */
    String generateNaturalQuestion(String intent, Map<String, String> knownSlots, String missingSlot,
                                   Language language);

    /**
     * Answers a general query or small talk.
     *
     * @param history  most recent turns, oldest first
     * @param text     latest user input
     * @param language language to answer in
     * @return a short reply suitable for speech, never blank
     */
    String generateConversationalReply(List<Turn> history, String text, Language language);
}
