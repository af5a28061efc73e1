package com.phillippitts.speakagent.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one conversation, threaded through the dialogue engine turn by turn.
 *
 * <p>The session is mutable but not thread-safe: exactly one turn may work on an instance at a
 * time. The engine works on a {@link #copy()} and hands the copy back, so the stored instance
 * only changes when a whole turn has completed.
 *
 * <p>Invariants kept by this class:
 * <ul>
 *   <li>the task status changes only through {@link #apply(DialogueEvent)}</li>
 *   <li>turns are append-only</li>
 *   <li>the clarification counter never exceeds the configured maximum</li>
 * </ul>
 */
public final class DialogueSession {

    /** Suffix of the resolved-entity key holding the referent id, e.g. {@code recipient_id}. */
    public static final String RESOLVED_ID_SUFFIX = "_id";

    private final String sessionId;
    private final String ownerId;
    private final int maxClarifications;

    private final List<Turn> turns = new ArrayList<>();
    private String inputText = "";
    private Language inputLanguage;
    private IntentGuess intent;
    private TaskStatus taskStatus = TaskStatus.IDLE;

    private final Map<String, String> entities = new LinkedHashMap<>();
    private final List<String> missingEntities = new ArrayList<>();
    private final List<String> unresolvedEntities = new ArrayList<>();
    private final Map<String, String> resolvedEntities = new LinkedHashMap<>();
    private boolean needsUserDisambiguation;
    private final List<DisambiguationOption> disambiguationOptions = new ArrayList<>();

    private int clarificationCount;
    private ActionResult actionResult;
    private String actionError;
    private String responseText;
    private boolean shouldSpeak;
    private int turnCount;

    public DialogueSession(String sessionId, String ownerId, int maxClarifications) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
        if (maxClarifications < 0) {
            throw new IllegalArgumentException("maxClarifications must be >= 0, got: " + maxClarifications);
        }
        this.maxClarifications = maxClarifications;
    }

    /**
     * Deep copy; collections are duplicated, immutable values are shared.
     */
    public DialogueSession copy() {
        DialogueSession c = new DialogueSession(sessionId, ownerId, maxClarifications);
        c.turns.addAll(turns);
        c.inputText = inputText;
        c.inputLanguage = inputLanguage;
        c.intent = intent;
        c.taskStatus = taskStatus;
        c.entities.putAll(entities);
        c.missingEntities.addAll(missingEntities);
        c.unresolvedEntities.addAll(unresolvedEntities);
        c.resolvedEntities.putAll(resolvedEntities);
        c.needsUserDisambiguation = needsUserDisambiguation;
        c.disambiguationOptions.addAll(disambiguationOptions);
        c.clarificationCount = clarificationCount;
        c.actionResult = actionResult;
        c.actionError = actionError;
        c.responseText = responseText;
        c.shouldSpeak = shouldSpeak;
        c.turnCount = turnCount;
        return c;
    }

    /**
     * Applies a step outcome to the task status.
     *
     * @return the status after the transition
     */
    public TaskStatus apply(DialogueEvent event) {
        Objects.requireNonNull(event, "event must not be null");
        taskStatus = TaskStatusTransitions.next(taskStatus, event);
        return taskStatus;
    }

    // Turns

    public void appendTurn(Turn turn) {
        turns.add(Objects.requireNonNull(turn, "turn must not be null"));
    }

    public List<Turn> getTurns() {
        return Collections.unmodifiableList(turns);
    }

    /**
     * Returns at most the {@code n} most recent turns, oldest first.
     */
    public List<Turn> recentTurns(int n) {
        if (n <= 0) {
            return List.of();
        }
        int from = Math.max(0, turns.size() - n);
        return List.copyOf(turns.subList(from, turns.size()));
    }

    public Optional<Turn> lastUserTurn() {
        for (int i = turns.size() - 1; i >= 0; i--) {
            Turn t = turns.get(i);
            if (t.role() == TurnRole.USER) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    // Slots

    /** Replaces the slot values with those of the latest guess. */
    public void replaceEntities(Map<String, String> values) {
        entities.clear();
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null) {
                    entities.put(k, v);
                }
            });
        }
    }

    public void setMissingEntities(List<String> names) {
        missingEntities.clear();
        missingEntities.addAll(names);
    }

    public void setUnresolvedEntities(List<String> names) {
        unresolvedEntities.clear();
        unresolvedEntities.addAll(names);
    }

    public void putResolvedEntity(String slot, String value) {
        resolvedEntities.put(slot, value);
    }

    /** Forgets every resolution; resolution is re-evaluated on each slot check. */
    public void clearResolvedEntities() {
        resolvedEntities.clear();
    }

    public void addDisambiguationOption(DisambiguationOption option) {
        disambiguationOptions.add(Objects.requireNonNull(option, "option must not be null"));
        needsUserDisambiguation = true;
    }

    /** Drops every piece of negotiated slot state (values, missing, unresolved, resolved, options). */
    public void clearSlotState() {
        entities.clear();
        missingEntities.clear();
        unresolvedEntities.clear();
        clearResolvedEntities();
        clearDisambiguation();
    }

    public void clearDisambiguation() {
        disambiguationOptions.clear();
        needsUserDisambiguation = false;
    }

    /**
     * Slot values for execution: literal values overlaid with resolved values.
     */
    public Map<String, String> mergedSlots() {
        Map<String, String> merged = new LinkedHashMap<>(entities);
        merged.putAll(resolvedEntities);
        return merged;
    }

    /**
     * Clears what the previous turn produced: reply, disambiguation, action outcome.
     */
    public void resetTurnOutput() {
        responseText = null;
        shouldSpeak = false;
        clearDisambiguation();
        actionResult = null;
        actionError = null;
    }

    // Clarification counter

    public void incrementClarificationCount() {
        if (clarificationCount >= maxClarifications) {
            throw new IllegalStateException("Clarification budget already exhausted: " + clarificationCount);
        }
        clarificationCount++;
    }

    public void resetClarificationCount() {
        clarificationCount = 0;
    }

    public boolean isClarificationBudgetExhausted() {
        return clarificationCount >= maxClarifications;
    }

    public void incrementTurnCount() {
        turnCount++;
    }

    // Accessors

    public String getSessionId() {
        return sessionId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public int getMaxClarifications() {
        return maxClarifications;
    }

    public String getInputText() {
        return inputText;
    }

    public void setInputText(String inputText) {
        this.inputText = inputText == null ? "" : inputText;
    }

    public Language getInputLanguage() {
        return inputLanguage;
    }

    public void setInputLanguage(Language inputLanguage) {
        this.inputLanguage = inputLanguage;
    }

    public IntentGuess getIntent() {
        return intent;
    }

    /** Current intent name, or {@link Intents#UNKNOWN} when no guess is held. */
    public String getIntentName() {
        return intent == null ? Intents.UNKNOWN : intent.intent();
    }

    public void setIntent(IntentGuess intent) {
        this.intent = intent;
    }

    public TaskStatus getTaskStatus() {
        return taskStatus;
    }

    public Map<String, String> getEntities() {
        return Collections.unmodifiableMap(entities);
    }

    public List<String> getMissingEntities() {
        return Collections.unmodifiableList(missingEntities);
    }

    public List<String> getUnresolvedEntities() {
        return Collections.unmodifiableList(unresolvedEntities);
    }

    public Map<String, String> getResolvedEntities() {
        return Collections.unmodifiableMap(resolvedEntities);
    }

    public boolean isNeedsUserDisambiguation() {
        return needsUserDisambiguation;
    }

    public List<DisambiguationOption> getDisambiguationOptions() {
        return Collections.unmodifiableList(disambiguationOptions);
    }

    public int getClarificationCount() {
        return clarificationCount;
    }

    public ActionResult getActionResult() {
        return actionResult;
    }

    public void setActionResult(ActionResult actionResult) {
        this.actionResult = actionResult;
    }

    public String getActionError() {
        return actionError;
    }

    public void setActionError(String actionError) {
        this.actionError = actionError;
    }

    public String getResponseText() {
        return responseText;
    }

    public boolean hasResponseText() {
        return responseText != null && !responseText.isEmpty();
    }

    public void setResponseText(String responseText) {
        this.responseText = responseText;
    }

    public boolean isShouldSpeak() {
        return shouldSpeak;
    }

    public void setShouldSpeak(boolean shouldSpeak) {
        this.shouldSpeak = shouldSpeak;
    }

    public int getTurnCount() {
        return turnCount;
    }

    @Override
    public String toString() {
        return "DialogueSession{id=" + sessionId
                + ", status=" + taskStatus
                + ", intent=" + getIntentName()
                + ", turns=" + turns.size()
                + ", clarifications=" + clarificationCount + '/' + maxClarifications
                + '}';
    }
}
