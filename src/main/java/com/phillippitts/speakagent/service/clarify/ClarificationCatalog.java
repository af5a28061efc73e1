package com.phillippitts.speakagent.service.clarify;

import com.phillippitts.speakagent.domain.EntityCandidate;
import com.phillippitts.speakagent.domain.Language;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canned clarification questions per slot, plus the fixed prompts used when negotiation
 * cannot go on. Read-only static tables, safe for concurrent use.
 */
public final class ClarificationCatalog {

    private static final Map<String, String> QUESTIONS_EN = Map.of(
            "recipient", "Who do you want to send the message to?",
            "message_content", "What should the message say?",
            "platform", "Which platform? WhatsApp, Telegram, or SMS?",
            "reminder_text", "What do you want me to remind you about?",
            "datetime", "When should I remind you?",
            "note_content", "What do you want to write down?",
            "app_name", "Which app do you want to open?",
            "url", "Which site do you want to go to?",
            "query", "What do you want to search for?",
            "duration", "How long should the timer be?"
    );

    private static final Map<String, String> QUESTIONS_ES = Map.of(
            "recipient", "¿A quién le querés enviar el mensaje?",
            "message_content", "¿Qué querés que diga el mensaje?",
            "platform", "¿Por qué plataforma? ¿WhatsApp, Telegram, o SMS?",
            "reminder_text", "¿Qué querés que te recuerde?",
            "datetime", "¿Cuándo querés que te avise?",
            "note_content", "¿Qué querés anotar?",
            "app_name", "¿Qué aplicación querés abrir?",
            "url", "¿A qué sitio querés ir?",
            "query", "¿Qué querés buscar?",
            "duration", "¿De cuánto tiempo el temporizador?"
    );

    private static final String NOT_FOUND_EN = "I couldn't find any contact named '";
    private static final String NOT_FOUND_ES = "No encontré ningún contacto llamado '";
    private static final String WHICH_ONE_EN = "I found several contacts: ";
    private static final String WHICH_ONE_ES = "Encontré varios contactos: ";

    private ClarificationCatalog() {
    }

    /** Canned question for a slot, if one exists. */
    public static Optional<String> questionFor(String slot, Language language) {
        return Optional.ofNullable(table(language).get(slot));
    }

    /**
     * Slot a previously asked question was about, in any language. Contact disambiguation
     * prompts are about {@code recipient}.
     */
    public static Optional<String> slotForQuestion(String question) {
        if (question == null || question.isBlank()) {
            return Optional.empty();
        }
        for (Map<String, String> table : List.of(QUESTIONS_EN, QUESTIONS_ES)) {
            for (Map.Entry<String, String> e : table.entrySet()) {
                if (e.getValue().equals(question)) {
                    return Optional.of(e.getKey());
                }
            }
        }
        if (question.startsWith(NOT_FOUND_EN) || question.startsWith(NOT_FOUND_ES)
                || question.startsWith(WHICH_ONE_EN) || question.startsWith(WHICH_ONE_ES)) {
            return Optional.of("recipient");
        }
        return Optional.empty();
    }

    /** Last-resort question when neither a canned nor a generated question is available. */
    public static String fallbackQuestion(String slot, Language language) {
        String name = slot == null ? "" : slot.replace('_', ' ');
        return language == Language.ES
                ? "¿Podrías darme más información sobre " + name + "?"
                : "Could you give me more information about " + name + "?";
    }

    public static String genericQuestion(Language language) {
        return language == Language.ES
                ? "¿Podrías darme más detalles?"
                : "Could you give me more details?";
    }

    /** Said instead of a question once the clarification budget is spent. */
    public static String startOver(Language language) {
        return language == Language.ES
                ? "Parece que estamos teniendo problemas para entendernos. ¿Podés repetir todo desde el principio?"
                : "Looks like we're having trouble understanding each other. "
                        + "Can you repeat everything from the start?";
    }

    public static String notFound(String query, Language language) {
        return language == Language.ES
                ? NOT_FOUND_ES + query + "'. ¿A quién te referís?"
                : NOT_FOUND_EN + query + "'. Who do you mean?";
    }

    /** Enumerates the candidates in lookup order, e.g. "1) Ana Diaz, 2) Ana Ruiz". */
    public static String whichOne(List<EntityCandidate> candidates, Language language) {
        StringBuilder listed = new StringBuilder();
        for (int i = 0; i < candidates.size(); i++) {
            if (i > 0) {
                listed.append(", ");
            }
            listed.append(i + 1).append(") ").append(candidates.get(i).displayName());
        }
        return language == Language.ES
                ? WHICH_ONE_ES + listed + ". ¿A cuál te referís?"
                : WHICH_ONE_EN + listed + ". Which one do you mean?";
    }


    private static Map<String, String> table(Language language) {
        return language == Language.ES ? QUESTIONS_ES : QUESTIONS_EN;
    }
}
