package com.phillippitts.speakagent.service.phrase;

import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.domain.TurnRole;
import com.phillippitts.speakagent.exception.ExternalCallException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Phrase generator backed by a LangChain4j chat model. Replies are kept short because they
 * are read aloud.
 */
public class LanguageModelPhraseGenerator implements PhraseGenerator {

    private final ChatLanguageModel model;

    public LanguageModelPhraseGenerator(ChatLanguageModel model) {
        this.model = Objects.requireNonNull(model, "model");
    }

    @Override
    public String generateNaturalQuestion(String intent, Map<String, String> knownSlots, String missingSlot,
                                          Language language) {
        String known = knownSlots == null || knownSlots.isEmpty()
                ? "none"
                : knownSlots.entrySet().stream()
                        .map(e -> e.getKey() + "=" + e.getValue())
                        .collect(Collectors.joining(", "));
        List<ChatMessage> messages = List.of(
                SystemMessage.from("You are a friendly voice assistant. Write ONE short, natural question "
                        + "that asks the user for the missing information. Answer in " + languageName(language)
                        + ". Reply with the question only."),
                UserMessage.from("Intent: " + intent + "\nKnown information: " + known
                        + "\nI still need: " + missingSlot));
        return ask("natural-question", messages);
    }

    @Override
    public String generateConversationalReply(List<Turn> history, String text, Language language) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from("You are a friendly, concise voice assistant. Answer briefly in "
                + languageName(language) + "; your replies are read aloud."));
        if (history != null) {
            for (Turn t : history) {
                if (t.content().isBlank()) {
                    continue;
                }
                switch (t.role()) {
                    case USER -> messages.add(UserMessage.from(t.content()));
                    case ASSISTANT -> messages.add(AiMessage.from(t.content()));
                    case SYSTEM -> { }
                }
            }
        }
        boolean alreadyLast = history != null && !history.isEmpty()
                && history.get(history.size() - 1).role() == TurnRole.USER
                && history.get(history.size() - 1).content().strip().equals(text);
        if (!alreadyLast && text != null && !text.isBlank()) {
            messages.add(UserMessage.from(text));
        }
        return ask("conversational-reply", messages);
    }

    private String ask(String callName, List<ChatMessage> messages) {
        Response<AiMessage> response;
        try {
            response = model.generate(messages);
        } catch (RuntimeException e) {
            throw new ExternalCallException("Language model call failed: " + e.getMessage(), callName, e);
        }
        String text = response == null || response.content() == null ? null : response.content().text();
        if (text == null || text.isBlank()) {
            throw new ExternalCallException("Language model returned an empty reply", callName);
        }
        return text.strip();
    }

    private static String languageName(Language language) {
        return language == Language.ES ? "casual Rioplatense Spanish" : "English";
    }
}
