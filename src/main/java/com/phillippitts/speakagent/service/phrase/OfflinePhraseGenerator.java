package com.phillippitts.speakagent.service.phrase;

import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.exception.ExternalCallException;

import java.util.List;
import java.util.Map;

/**
 * Phrase generator used when no language model is configured. Every call fails, so the
 * canned fallback questions and replies are used.
 */
public class OfflinePhraseGenerator implements PhraseGenerator {

    @Override
    public String generateNaturalQuestion(String intent, Map<String, String> knownSlots, String missingSlot,
                                          Language language) {
        throw new ExternalCallException("No language model configured", "natural-question");
    }

    @Override
    public String generateConversationalReply(List<Turn> history, String text, Language language) {
        throw new ExternalCallException("No language model configured", "conversational-reply");
    }
}
