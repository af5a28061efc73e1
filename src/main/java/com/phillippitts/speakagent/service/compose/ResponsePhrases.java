package com.phillippitts.speakagent.service.compose;

import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.domain.Language;

import java.util.Map;

/**
 * Fixed reply phrases in every supported language.
 */
public final class ResponsePhrases {

    private static final Map<String, String> SUCCESS_EN = Map.of(
            Intents.SEND_MESSAGE, "Message sent.",
            Intents.SET_REMINDER, "OK, I'll remind you.",
            Intents.CREATE_NOTE, "Note saved.",
            Intents.OPEN_APP, "Opening...",
            Intents.OPEN_URL, "Opening the page...",
            Intents.SEARCH_WEB, "Here's what I found.",
            Intents.SET_TIMER, "Timer started."
    );

    private static final Map<String, String> SUCCESS_ES = Map.of(
            Intents.SEND_MESSAGE, "Listo, mensaje enviado.",
            Intents.SET_REMINDER, "Dale, te voy a recordar.",
            Intents.CREATE_NOTE, "Nota guardada.",
            Intents.OPEN_APP, "Abriendo...",
            Intents.OPEN_URL, "Abriendo la página...",
            Intents.SEARCH_WEB, "Acá está lo que encontré.",
            Intents.SET_TIMER, "Temporizador activado."
    );

    private ResponsePhrases() {
    }

    /** Acknowledgement said by the cancel step. */
    public static String cancelAcknowledgement(Language language) {
        return es(language) ? "Dale, cancelado. ¿Algo más?" : "OK, cancelled. Anything else?";
    }

    /** Reply composed for a cancelled task when no upstream step already answered. */
    public static String cancelled(Language language) {
        return es(language)
                ? "Dale, cancelado. ¿En qué más te puedo ayudar?"
                : "OK, cancelled. What else can I help you with?";
    }

    public static String success(String intent, Language language) {
        String phrase = (es(language) ? SUCCESS_ES : SUCCESS_EN).get(intent);
        if (phrase != null) {
            return phrase;
        }
        return es(language) ? "Listo." : "Done.";
    }

    public static String failure(String error, Language language) {
        if (es(language)) {
            String msg = error == null || error.isBlank() ? "algo salió mal" : error;
            return "Ups, hubo un problema: " + msg + ". ¿Querés que lo intente de nuevo?";
        }
        String msg = error == null || error.isBlank() ? "something went wrong" : error;
        return "Oops, there was a problem: " + msg + ". Want me to try again?";
    }

    public static String greeting(Language language) {
        return es(language) ? "¡Hola! ¿En qué te puedo ayudar?" : "Hi! How can I help?";
    }

    public static String acknowledgement(Language language) {
        return es(language) ? "Listo, ¿algo más?" : "Done, anything else?";
    }

    /** Said when no conversational reply could be produced. */
    public static String trouble(Language language) {
        return es(language)
                ? "Perdón, tuve un problema para procesar eso. ¿Podrías repetirlo?"
                : "Sorry, I had trouble processing that. Could you repeat it?";
    }

    private static boolean es(Language language) {
        return language == Language.ES;
    }
}
