package com.phillippitts.speakagent.service.clarify;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import com.phillippitts.speakagent.service.metrics.DialogueMetricsPublisher;
import com.phillippitts.speakagent.service.phrase.PhraseGenerator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Asks the user one question about the first thing still blocking the task.
 *
 * <p>What to ask, in priority order:
 * <ol>
 *   <li>the prompt of the first disambiguation option, verbatim</li>
 *   <li>the canned question for the first missing slot</li>
 *   <li>a generated question for that slot, or the fixed fallback if generation fails</li>
 * </ol>
 * Before asking, the clarification budget is checked: once it is spent the question is
 * dropped, the user is asked to start over and the task is cancelled.
 */
public class Clarifier {
    private static final Logger LOG = LogManager.getLogger(Clarifier.class);

    private final PhraseGenerator phraseGenerator;
    private final ExternalCallGuard guard;
    private final DialogueMetricsPublisher metrics;

    public Clarifier(PhraseGenerator phraseGenerator, ExternalCallGuard guard, DialogueMetricsPublisher metrics) {
        this.phraseGenerator = Objects.requireNonNull(phraseGenerator, "phraseGenerator");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public DialogueEvent clarify(DialogueSession session) {
        Language language = session.getInputLanguage();
        if (session.isClarificationBudgetExhausted()) {
            LOG.info("Clarification budget exhausted ({}/{}); asking user to start over",
                    session.getClarificationCount(), session.getMaxClarifications());
            say(session, ClarificationCatalog.startOver(language));
            metrics.recordClarification("exhausted");
            return DialogueEvent.CLARIFICATIONS_EXHAUSTED;
        }

        String question = question(session, language);
        session.incrementClarificationCount();
        say(session, question);
        metrics.recordClarification("asked");
        return DialogueEvent.CLARIFICATION_REQUESTED;
    }

    private String question(DialogueSession session, Language language) {
        if (!session.getDisambiguationOptions().isEmpty()) {
            return session.getDisambiguationOptions().get(0).prompt();
        }
        if (session.getMissingEntities().isEmpty()) {
            return ClarificationCatalog.genericQuestion(language);
        }
        String slot = session.getMissingEntities().get(0);
        return ClarificationCatalog.questionFor(slot, language)
                .orElseGet(() -> generated(session, slot, language));
    }

    private String generated(DialogueSession session, String slot, Language language) {
        try {
            String q = guard.call("natural-question", () -> phraseGenerator.generateNaturalQuestion(
                    session.getIntentName(), session.getEntities(), slot, language));
            if (q != null && !q.isBlank()) {
                return q.strip();
            }
        } catch (RuntimeException e) {
            LOG.warn("Question generation for slot '{}' failed: {}", slot, e.getMessage());
        }
        return ClarificationCatalog.fallbackQuestion(slot, language);
    }

    private static void say(DialogueSession session, String text) {
        session.setResponseText(text);
        session.setShouldSpeak(true);
        session.appendTurn(Turn.assistant(text));
    }
}
