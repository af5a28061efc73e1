package com.phillippitts.speakagent.service.dispatch;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.service.compose.ResponsePhrases;
import com.phillippitts.speakagent.service.dialogue.event.SkillFailedEvent;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import com.phillippitts.speakagent.service.metrics.DialogueMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Executes the session's intent through the registered skill.
 *
 * <p>Literal and resolved slot values are merged (resolved values win) and handed to the
 * skill. A missing skill, a failure result and a thrown fault all end in
 * {@link DialogueEvent#ACTION_FAILED} with the reason on the session's action error; nothing
 * propagates out of {@link #dispatch(DialogueSession)}.
 *
 * <p>For system-action intents the reply is decided here: on success the skill message (or
 * the intent's success phrase) becomes the response text.
 */
public class ActionDispatcher {
    private static final Logger LOG = LogManager.getLogger(ActionDispatcher.class);

    private final SkillRegistry registry;
    private final ExternalCallGuard guard;
    private final Set<String> systemActionIntents;
    private final ApplicationEventPublisher publisher;
    private final DialogueMetricsPublisher metrics;

    public ActionDispatcher(SkillRegistry registry,
                            ExternalCallGuard guard,
                            Set<String> systemActionIntents,
                            ApplicationEventPublisher publisher,
                            DialogueMetricsPublisher metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.guard = Objects.requireNonNull(guard, "guard");
        this.systemActionIntents = Set.copyOf(systemActionIntents);
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public DialogueEvent dispatch(DialogueSession session) {
        session.apply(DialogueEvent.EXECUTION_STARTED);
        String intent = session.getIntentName();

        Optional<Skill> skill = registry.lookup(intent);
        if (skill.isEmpty()) {
            String error = "no handler for intent: " + intent;
            LOG.warn("Dispatch failed: {}", error);
            metrics.recordDispatch(intent, "no_handler");
            return fail(session, intent, error);
        }

        Map<String, String> merged = session.mergedSlots();
        String ownerId = session.getOwnerId();
        ActionResult result;
        try {
            result = guard.call("skill-" + intent, () -> skill.get().execute(ownerId, merged));
        } catch (RuntimeException e) {
            LOG.error("Skill '{}' threw during execution", intent, e);
            result = ActionResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
        if (result == null) {
            result = ActionResult.failure("skill returned no result");
        }
        session.setActionResult(result);

        if (!result.success()) {
            String error = result.message() == null || result.message().isBlank() ? "action failed" : result.message();
            LOG.warn("Skill '{}' reported failure: {}", intent, error);
            metrics.recordDispatch(intent, "failure");
            return fail(session, intent, error);
        }

        metrics.recordDispatch(intent, "success");
        if (systemActionIntents.contains(intent)) {
            String reply = result.message() == null || result.message().isBlank()
                    ? ResponsePhrases.success(intent, session.getInputLanguage())
                    : result.message();
            session.setResponseText(reply);
            session.setShouldSpeak(true);
            session.appendTurn(Turn.assistant(reply));
        }
        return DialogueEvent.ACTION_SUCCEEDED;
    }

    private DialogueEvent fail(DialogueSession session, String intent, String error) {
        session.setActionError(error);
        if (session.getActionResult() == null || session.getActionResult().success()) {
            session.setActionResult(ActionResult.failure(error));
        }
        publisher.publishEvent(new SkillFailedEvent(session.getSessionId(), intent, error, Instant.now()));
        return DialogueEvent.ACTION_FAILED;
    }
}
