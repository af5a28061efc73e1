package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.TaskStatus;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.service.clarify.Clarifier;
import com.phillippitts.speakagent.service.compose.ResponseComposer;
import com.phillippitts.speakagent.service.compose.ResponsePhrases;
import com.phillippitts.speakagent.service.dispatch.ActionDispatcher;
import com.phillippitts.speakagent.service.metrics.DialogueMetricsPublisher;
import com.phillippitts.speakagent.service.resolve.EntityResolver;
import com.phillippitts.speakagent.service.slots.SlotChecker;
import com.phillippitts.speakagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Objects;

/**
 * Step-loop implementation of {@link DialogueEngine}.
 *
 * <p>Each step returns one {@link DialogueEvent}; the event is applied to the session's task
 * status and {@link StepTransitions} picks the next step, until the reply is composed.
 *
 * <p>The turn runs on a copy of the given session. A step that throws is recorded as
 * {@link DialogueEvent#STEP_FAILED} and the turn continues to compose a reply.
 */
public class DefaultDialogueEngine implements DialogueEngine {
    private static final Logger LOG = LogManager.getLogger(DefaultDialogueEngine.class);

    /** Upper bound on steps per turn; the longest legal path takes nine. */
    static final int MAX_STEPS = 32;

    private static final String MDC_SESSION_ID = "sessionId";

    private final InputNormalizer normalizer;
    private final IntentDetector detector;
    private final IntentRouter router;
    private final SlotChecker slotChecker;
    private final EntityResolver resolver;
    private final Clarifier clarifier;
    private final ActionDispatcher dispatcher;
    private final ResponseComposer composer;
    private final DialogueMetricsPublisher metrics;

    public DefaultDialogueEngine(InputNormalizer normalizer,
                                 IntentDetector detector,
                                 IntentRouter router,
                                 SlotChecker slotChecker,
                                 EntityResolver resolver,
                                 Clarifier clarifier,
                                 ActionDispatcher dispatcher,
                                 ResponseComposer composer,
                                 DialogueMetricsPublisher metrics) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.router = Objects.requireNonNull(router, "router");
        this.slotChecker = Objects.requireNonNull(slotChecker, "slotChecker");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.clarifier = Objects.requireNonNull(clarifier, "clarifier");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.composer = Objects.requireNonNull(composer, "composer");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    @Override
    public TurnReply processTurn(DialogueSession session, String utterance) {
        Objects.requireNonNull(session, "session must not be null");
        long start = System.nanoTime();
        String previousSessionId = ThreadContext.get(MDC_SESSION_ID);
        ThreadContext.put(MDC_SESSION_ID, session.getSessionId());
        try {
            DialogueSession working = session.copy();
            beginTurn(working, utterance);
            run(working);
            ensureReply(working);

            long elapsedNanos = System.nanoTime() - start;
            metrics.recordTurn(working.getTaskStatus().name(), elapsedNanos);
            LOG.info("Turn {} done: intent={}, status={}, clarifications={}/{}, {} ms",
                    working.getTurnCount(), working.getIntentName(), working.getTaskStatus(),
                    working.getClarificationCount(), working.getMaxClarifications(), elapsedNanos / 1_000_000L);
            return new TurnReply(working, working.getResponseText(), working.isShouldSpeak());
        } finally {
            if (previousSessionId == null) {
                ThreadContext.remove(MDC_SESSION_ID);
            } else {
                ThreadContext.put(MDC_SESSION_ID, previousSessionId);
            }
        }
    }

    private void beginTurn(DialogueSession session, String utterance) {
        TaskStatus previous = session.getTaskStatus();
        // Cancel resets the counter; a cancellation forced by exhaustion leaves it at the
        // maximum until the next turn starts a new task.
        if (previous == TaskStatus.CANCELLED) {
            session.resetClarificationCount();
        }
        session.resetTurnOutput();
        session.appendTurn(Turn.user(utterance));
        LOG.debug("Turn started (previous status={}): {}", previous,
                LogSanitizer.preview(utterance, LogSanitizer.DEFAULT_PREVIEW));
    }

    private void run(DialogueSession session) {
        DialogueStep step = DialogueStep.NORMALIZE;
        int steps = 0;
        while (step != DialogueStep.DONE) {
            if (++steps > MAX_STEPS) {
                LOG.error("Step budget of {} exceeded at {}; ending turn", MAX_STEPS, step);
                return;
            }
            DialogueEvent event;
            try {
                event = execute(step, session);
            } catch (RuntimeException e) {
                if (step == DialogueStep.COMPOSE) {
                    LOG.error("Composing the reply failed", e);
                    say(session, ResponsePhrases.trouble(session.getInputLanguage()));
                    return;
                }
                LOG.error("Dialogue step {} failed", step, e);
                session.setActionError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
                event = DialogueEvent.STEP_FAILED;
            }
            TaskStatus status = session.apply(event);
            LOG.debug("{} -> {} (status={})", step, event, status);
            step = StepTransitions.nextStep(event);
        }
    }

    private DialogueEvent execute(DialogueStep step, DialogueSession session) {
        return switch (step) {
            case NORMALIZE -> normalizer.normalize(session);
            case CLASSIFY -> detector.detect(session);
            case ROUTE -> router.route(session.getIntent() == null ? null : session.getIntent().intent());
            case CHECK_SLOTS -> checkSlots(session);
            case RESOLVE -> resolver.resolve(session);
            case CLARIFY -> clarifier.clarify(session);
            case DISPATCH -> dispatcher.dispatch(session);
            case CANCEL -> cancel(session);
            case CONFIRM -> confirm(session);
            case COMPOSE -> composer.compose(session);
            case DONE -> throw new IllegalStateException("DONE is not executable");
        };
    }

    private DialogueEvent checkSlots(DialogueSession session) {
        SlotChecker.Result result = slotChecker.check(session.getIntentName(), session.getEntities());
        session.setMissingEntities(result.missing());
        session.setUnresolvedEntities(result.unresolved());
        session.clearResolvedEntities();
        if (!result.missing().isEmpty()) {
            LOG.debug("Missing slots for {}: {}", session.getIntentName(), result.missing());
            return DialogueEvent.SLOTS_MISSING;
        }
        if (!result.unresolved().isEmpty()) {
            return DialogueEvent.SLOTS_NEED_RESOLUTION;
        }
        return DialogueEvent.SLOTS_COMPLETE;
    }

    private DialogueEvent cancel(DialogueSession session) {
        session.setIntent(null);
        session.clearSlotState();
        session.resetClarificationCount();
        say(session, ResponsePhrases.cancelAcknowledgement(session.getInputLanguage()));
        return DialogueEvent.TASK_CANCELLED;
    }

    private DialogueEvent confirm(DialogueSession session) {
        // Executes whatever intent the session holds; nothing checks that an action was pending.
        LOG.warn("Confirmation received without a pending-action check; dispatching intent '{}'",
                session.getIntentName());
        return DialogueEvent.ACTION_CONFIRMED;
    }

    private void ensureReply(DialogueSession session) {
        if (!session.hasResponseText()) {
            LOG.warn("Turn ended without a reply; using fallback");
            say(session, ResponsePhrases.trouble(session.getInputLanguage()));
        }
    }

    private static void say(DialogueSession session, String text) {
        session.setResponseText(text);
        session.setShouldSpeak(true);
        session.appendTurn(Turn.assistant(text));
    }
}
