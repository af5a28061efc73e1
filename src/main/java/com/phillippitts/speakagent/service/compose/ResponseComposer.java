package com.phillippitts.speakagent.service.compose;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import com.phillippitts.speakagent.service.phrase.PhraseGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Produces the reply of a turn from the final task status and the action outcome.
 *
 * <p>A reply already decided upstream (cancel, clarify, system action) is kept as is and
 * not appended again, so composing twice is a no-op. Otherwise the reply is chosen by
 * status first (completed, failed, cancelled), then by intent (conversation, greeting).
 */
public class ResponseComposer {
    private static final Logger LOG = LogManager.getLogger(ResponseComposer.class);

    private final PhraseGenerator phraseGenerator;
    private final ExternalCallGuard guard;
    private final int historyWindow;

    public ResponseComposer(PhraseGenerator phraseGenerator, ExternalCallGuard guard, int historyWindow) {
        this.phraseGenerator = Objects.requireNonNull(phraseGenerator, "phraseGenerator");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.historyWindow = historyWindow;
    }

    public DialogueEvent compose(DialogueSession session) {
        if (session.hasResponseText()) {
            session.setShouldSpeak(true);
            return DialogueEvent.REPLY_COMPOSED;
        }
        String reply = reply(session);
        session.setResponseText(reply);
        session.setShouldSpeak(true);
        session.appendTurn(Turn.assistant(reply));
        return DialogueEvent.REPLY_COMPOSED;
    }

    private String reply(DialogueSession session) {
        Language language = session.getInputLanguage();
        String intent = session.getIntentName();
        return switch (session.getTaskStatus()) {
            case COMPLETED -> success(session.getActionResult(), intent, language);
            case FAILED -> ResponsePhrases.failure(session.getActionError(), language);
            case CANCELLED -> ResponsePhrases.cancelled(language);
            default -> byIntent(session, intent, language);
        };
    }

    private String byIntent(DialogueSession session, String intent, Language language) {
        if (Intents.GENERAL_QUERY.equals(intent) || Intents.UNKNOWN.equals(intent)) {
            return conversational(session, language);
        }
        if (Intents.GREETING.equals(intent)) {
            return ResponsePhrases.greeting(language);
        }
        return ResponsePhrases.acknowledgement(language);
    }

    private static String success(ActionResult result, String intent, Language language) {
        if (result != null && result.message() != null && !result.message().isBlank()) {
            return result.message();
        }
        return ResponsePhrases.success(intent, language);
    }

    private String conversational(DialogueSession session, Language language) {
        try {
            String reply = guard.call("conversational-reply", () -> phraseGenerator.generateConversationalReply(
                    session.recentTurns(historyWindow), session.getInputText(), language));
            if (reply != null && !reply.isBlank()) {
                return reply.strip();
            }
        } catch (RuntimeException e) {
            LOG.warn("Conversational reply failed: {}", e.getMessage());
        }
        return ResponsePhrases.trouble(language);
    }
}
