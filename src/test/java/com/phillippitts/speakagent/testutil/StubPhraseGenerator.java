package com.phillippitts.speakagent.testutil;

import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.exception.ExternalCallException;
import com.phillippitts.speakagent.service.phrase.PhraseGenerator;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Phrase generator double with fixed answers; a null answer makes the call fail.
 */
public class StubPhraseGenerator implements PhraseGenerator {

    private final String question;
    private final String reply;
    private final AtomicInteger calls = new AtomicInteger();

    public StubPhraseGenerator(String question, String reply) {
        this.question = question;
        this.reply = reply;
    }

    public static StubPhraseGenerator failing() {
        return new StubPhraseGenerator(null, null);
    }

    @Override
    public String generateNaturalQuestion(String intent, Map<String, String> knownSlots, String missingSlot,
                                          Language language) {
        calls.incrementAndGet();
        if (question == null) {
            throw new ExternalCallException("stub has no question", "natural-question");
        }
        return question;
    }

    @Override
    public String generateConversationalReply(List<Turn> history, String text, Language language) {
        calls.incrementAndGet();
        if (reply == null) {
            throw new ExternalCallException("stub has no reply", "conversational-reply");
        }
        return reply;
    }

    public int calls() {
        return calls.get();
    }
}
