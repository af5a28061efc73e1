package com.phillippitts.speakagent.service.classify;

import com.phillippitts.speakagent.domain.IntentGuess;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.domain.TurnRole;
import com.phillippitts.speakagent.service.clarify.ClarificationCatalog;
import com.phillippitts.speakagent.util.TextFolding;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline intent classifier driven by keyword and pattern rules in English and Spanish.
 *
 * <p>Used when no language model is configured. Whole-utterance phrases decide cancel,
 * confirm and greeting, and a cancel phrase also counts when it opens the utterance
 * ("cancel the timer"); one inside a request ("text mom that we should cancel dinner") does
 * not. Then each action rule tries its patterns in order (the first full
 * match fills the slots) and falls back to keywords (intent without slots).
 *
 * <p>An utterance no rule matches that answers a clarifying question (the previous
 * assistant turn is a canned question) continues the earlier request: the earlier user
 * turn is classified again and the answer fills the slot that was asked about. Anything
 * else is a low-confidence {@code general_query}.
 */
public class RuleBasedIntentClassifier implements IntentClassifier {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final Set<String> CANCEL_UTTERANCES = Set.of(
            "no", "stop", "cancel", "cancel it", "cancel that", "never mind", "nevermind", "forget it",
            "cancelar", "cancela", "cancelalo", "olvidate", "deja", "dejalo", "para", "no importa");
    private static final List<String> CANCEL_PHRASES = List.of(
            "cancel", "never mind", "forget it", "cancelar", "cancela", "olvidate", "no importa");

    private static final Set<String> CONFIRM_UTTERANCES = Set.of(
            "yes", "yeah", "yep", "sure", "ok", "okay", "confirm", "do it", "go ahead", "yes please",
            "si", "dale", "confirmo", "confirmar", "hacelo", "de acuerdo", "si por favor");

    private static final Set<String> GREETING_UTTERANCES = Set.of(
            "hi", "hello", "hey", "hi there", "hello there", "hey there", "good morning",
            "good afternoon", "good evening", "hola", "buenas", "buen dia", "buenos dias",
            "buenas tardes", "buenas noches", "que tal", "hola que tal");

    private static final Pattern POLITE_PREFIX = Pattern.compile(
            "^(?:(?:please|can you|could you|would you|ok|okay|por favor|podrias|podes|che)[,\\s]+)+", FLAGS);

    private static final List<Rule> RULES = List.of(
            new Rule(Intents.SET_TIMER,
                    List.of(
                            slots("(?:set|start|put)?\\s*(?:a\\s+|an\\s+)?timer\\s+(?:for\\s+)?(.+)", "duration"),
                            slots("(?:pon[eé]|activ[aá]|pone)?\\s*(?:un\\s+)?temporizador\\s+(?:de\\s+|por\\s+)?(.+)",
                                    "duration")),
                    List.of("timer", "temporizador")),
            new Rule(Intents.SET_REMINDER,
                    List.of(
                            slots("remind\\s+me\\s+(?:to\\s+|about\\s+)?(.+?)\\s+((?:at|in|on|tomorrow|tonight|today|"
                                    + "next|every)\\b.*)", "reminder_text", "datetime"),
                            slots("remind\\s+me\\s+(?:to\\s+|about\\s+)?(.+)", "reminder_text"),
                            slots("record[aá]me\\s+(?:que\\s+)?(.+?)\\s+((?:a\\s+las|mañana|hoy|en|el|esta|"
                                    + "todos)\\b.*)", "reminder_text", "datetime"),
                            slots("record[aá]me\\s+(?:que\\s+)?(.+)", "reminder_text")),
                    List.of("remind me", "reminder", "recordame", "recordatorio")),
            new Rule(Intents.SEND_MESSAGE,
                    List.of(
                            slots("(?:send|write)\\s+(?:a\\s+)?(?:message|text)\\s+to\\s+(\\p{L}+(?:\\s+\\p{L}+)?)"
                                    + "\\s+(?:saying|that says|that)\\s+(.+)", "recipient", "message_content"),
                            slots("(?:send|write)\\s+(?:a\\s+)?(?:message|text)\\s+to\\s+(\\p{L}+(?:\\s+\\p{L}+)?)",
                                    "recipient"),
                            slots("(?:text|message|tell)\\s+(?!me\\b|us\\b)(\\p{L}+)\\s+(?:that\\s+|saying\\s+)?(.+)",
                                    "recipient", "message_content"),
                            slots("(?:text|message)\\s+(\\p{L}+)", "recipient"),
                            slots("(?:mand[aá]le|envi[aá]le|escribile)\\s+(?:un\\s+)?(?:mensaje\\s+)?a\\s+"
                                    + "(\\p{L}+(?:\\s+\\p{L}+)?)\\s+(?:diciendo|que diga|que)\\s+(.+)",
                                    "recipient", "message_content"),
                            slots("(?:mand[aá]le|envi[aá]le|escribile)\\s+(?:un\\s+)?(?:mensaje\\s+)?a\\s+"
                                    + "(\\p{L}+(?:\\s+\\p{L}+)?)", "recipient")),
                    List.of("send a message", "send message", "message", "text", "mensaje", "mandale",
                            "enviale", "escribile")),
            new Rule(Intents.CREATE_NOTE,
                    List.of(
                            slots("(?:create|make|take|write)\\s+(?:a\\s+)?note\\s*(?::|saying|that says|that)?\\s+(.+)",
                                    "note_content"),
                            slots("note\\s+(?:that\\s+|down\\s+)?(.+)", "note_content"),
                            slots("(?:anot[aá]|apunt[aá])\\s+(?:que\\s+)?(.+)", "note_content")),
                    List.of("note", "nota", "anota", "apunta")),
            new Rule(Intents.OPEN_URL,
                    List.of(
                            slots("(?:open|go to|visit|navigate to|abr[ií]|and[aá] a|ir a)\\s+"
                                    + "((?:https?://)?[\\w-]+(?:\\.[\\w-]+)*\\.[a-z]{2,}(?:/\\S*)?)", "url")),
                    List.of()),
            new Rule(Intents.OPEN_APP,
                    List.of(
                            slots("(?:open|launch|start|abr[ií]|abrir|inici[aá])\\s+(?:the\\s+|la\\s+|el\\s+)?"
                                    + "(?:app\\s+|aplicaci[oó]n\\s+)?(.+)", "app_name")),
                    List.of("open", "launch", "abrir", "abri")),
            new Rule(Intents.SEARCH_WEB,
                    List.of(
                            slots("(?:search|google|look up)\\s+(?:the web\\s+|online\\s+)?(?:for\\s+)?(.+)", "query"),
                            slots("busc[aá]\\s+(?:en internet\\s+|en google\\s+)?(.+)", "query")),
                    List.of("search", "google", "buscar", "busca"))
    );

    @Override
    public IntentGuess classify(List<Turn> history, String text) {
        IntentGuess direct = classifyUtterance(text);
        if (!Intents.GENERAL_QUERY.equals(direct.intent())) {
            return direct;
        }
        return continuation(history == null ? List.of() : history, text).orElse(direct);
    }

    private Optional<IntentGuess> continuation(List<Turn> history, String text) {
        int end = history.size();
        if (end > 0 && history.get(end - 1).role() == TurnRole.USER
                && history.get(end - 1).content().strip().equals(text.strip())) {
            end--;
        }
        if (end < 2 || history.get(end - 1).role() != TurnRole.ASSISTANT) {
            return Optional.empty();
        }
        Optional<String> askedSlot = ClarificationCatalog.slotForQuestion(history.get(end - 1).content());
        if (askedSlot.isEmpty()) {
            return Optional.empty();
        }
        int previousUser = end - 2;
        while (previousUser >= 0 && history.get(previousUser).role() != TurnRole.USER) {
            previousUser--;
        }
        if (previousUser < 0) {
            return Optional.empty();
        }
        Turn earlier = history.get(previousUser);
        IntentGuess before = classify(history.subList(0, previousUser + 1), earlier.content());
        if (Intents.CONVERSATIONAL.contains(before.intent())
                || Intents.CANCEL.equals(before.intent()) || Intents.CONFIRM.equals(before.intent())) {
            return Optional.empty();
        }
        Map<String, String> slots = new LinkedHashMap<>(before.slots());
        slots.put(askedSlot.get(), text.strip());
        return Optional.of(guess(before.intent(), 0.75, slots, "answer about " + askedSlot.get()));
    }

    private IntentGuess classifyUtterance(String text) {
        String utterance = stripPolitePrefix(text);
        String folded = String.join(" ", TextFolding.words(utterance));

        if (CANCEL_UTTERANCES.contains(folded)
                || CANCEL_PHRASES.stream().anyMatch(p -> startsWithPhrase(folded, p))) {
            return guess(Intents.CANCEL, 0.95, Map.of(), "cancel phrase");
        }
        if (CONFIRM_UTTERANCES.contains(folded)) {
            return guess(Intents.CONFIRM, 0.9, Map.of(), "confirmation phrase");
        }
        if (GREETING_UTTERANCES.contains(folded)) {
            return guess(Intents.GREETING, 0.95, Map.of(), "greeting phrase");
        }

        String body = utterance.replaceAll("[.!?¡¿]+$", "").trim();
        for (Rule rule : RULES) {
            for (SlotPattern sp : rule.patterns()) {
                Matcher m = sp.pattern().matcher(body);
                if (m.matches()) {
                    return guess(rule.intent(), 0.85, sp.extract(m), "pattern " + sp.pattern().pattern());
                }
            }
        }
        for (Rule rule : RULES) {
            if (rule.keywords().stream().anyMatch(k -> TextFolding.containsPhrase(utterance, k))) {
                return guess(rule.intent(), 0.6, Map.of(), "keyword");
            }
        }
        return guess(Intents.GENERAL_QUERY, 0.3, Map.of(), "no rule matched");
    }

    @Override
    public String name() {
        return "rule-based";
    }

    static String stripPolitePrefix(String text) {
        if (text == null) {
            return "";
        }
        return POLITE_PREFIX.matcher(text.trim()).replaceFirst("").trim();
    }

    /** {@code folded} is a word-folded utterance; phrases are already folded. */
    private static boolean startsWithPhrase(String folded, String phrase) {
        return folded.equals(phrase) || folded.startsWith(phrase + " ");
    }

    private static IntentGuess guess(String intent, double confidence, Map<String, String> slots, String why) {
        return new IntentGuess(intent, confidence, slots, List.of(), why);
    }

    private static SlotPattern slots(String regex, String... slotNames) {
        return new SlotPattern(Pattern.compile(regex, FLAGS), List.of(slotNames));
    }

    private record Rule(String intent, List<SlotPattern> patterns, List<String> keywords) {}

    private record SlotPattern(Pattern pattern, List<String> slotNames) {
        Map<String, String> extract(Matcher m) {
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < slotNames.size() && i < m.groupCount(); i++) {
                String v = m.group(i + 1);
                if (v != null && !v.isBlank()) {
                    values.put(slotNames.get(i), v.trim());
                }
            }
            return values;
        }
    }
}
