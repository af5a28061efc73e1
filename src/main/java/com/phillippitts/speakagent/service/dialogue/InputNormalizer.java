package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.util.TextFolding;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Prepares the latest user turn for classification: trims it and tags its language.
 *
 * <p>The language tag starts at the configured primary language and switches when a marker
 * word of another language appears. It is a heuristic that only affects phrasing.
 */
public class InputNormalizer {

    private static final Map<Language, List<String>> MARKERS = Map.of(
            Language.ES, List.of("hola", "por favor", "gracias", "quiero", "necesito", "mandale", "enviale",
                    "recordame", "recuerdame", "anota", "abri", "abrir", "busca", "que", "como", "cuando",
                    "donde", "mensaje", "cancelar", "olvidate", "temporizador", "dale", "buenas",
                    "buenos dias", "podes", "podrias", "che"),
            Language.EN, List.of("hello", "hi", "please", "thank you", "thanks", "yes", "what", "how", "send",
                    "remind", "open", "search", "cancel", "timer", "note", "message", "the"));

    private final Language primary;

    public InputNormalizer(Language primary) {
        this.primary = Objects.requireNonNull(primary, "primary");
    }

    public DialogueEvent normalize(DialogueSession session) {
        Optional<Turn> last = session.lastUserTurn();
        if (last.isEmpty()) {
            if (session.getInputLanguage() == null) {
                session.setInputLanguage(primary);
            }
            return DialogueEvent.INPUT_NORMALIZED;
        }
        String text = last.get().content().strip();
        session.setInputText(text);
        session.setInputLanguage(detectLanguage(text));
        session.incrementTurnCount();
        return DialogueEvent.INPUT_NORMALIZED;
    }

    Language detectLanguage(String text) {
        for (Language candidate : Language.values()) {
            if (candidate == primary) {
                continue;
            }
            for (String marker : MARKERS.getOrDefault(candidate, List.of())) {
                if (TextFolding.containsPhrase(text, marker)) {
                    return candidate;
                }
            }
        }
        return primary;
    }
}
