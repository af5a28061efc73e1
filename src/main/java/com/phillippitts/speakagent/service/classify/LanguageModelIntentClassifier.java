package com.phillippitts.speakagent.service.classify;

import com.phillippitts.speakagent.domain.IntentGuess;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.domain.TurnRole;
import com.phillippitts.speakagent.exception.ClassificationException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Intent classifier backed by a LangChain4j chat model.
 *
 * <p>Sends the classification instructions, the recent turns and the latest input, then
 * parses the JSON answer with {@link IntentGuessParser}.
 */
public class LanguageModelIntentClassifier implements IntentClassifier {
    private static final Logger LOG = LogManager.getLogger(LanguageModelIntentClassifier.class);

    private final ChatLanguageModel model;
    private final IntentGuessParser parser;

    public LanguageModelIntentClassifier(ChatLanguageModel model, IntentGuessParser parser) {
        this.model = Objects.requireNonNull(model, "model");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    @Override
    public IntentGuess classify(List<Turn> history, String text) {
        List<ChatMessage> messages = buildMessages(history, text);
        Response<AiMessage> response;
        try {
            response = model.generate(messages);
        } catch (RuntimeException e) {
            throw new ClassificationException("Classification model call failed: " + e.getMessage(), e);
        }
        String reply = response == null || response.content() == null ? null : response.content().text();
        IntentGuess guess = parser.parse(reply);
        LOG.debug("Classified as {} (confidence={})", guess.intent(), guess.confidence());
        return guess;
    }

    @Override
    public String name() {
        return "language-model";
    }

    List<ChatMessage> buildMessages(List<Turn> history, String text) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(IntentPrompts.SYSTEM));
        List<Turn> context = history == null ? List.of() : history;
        int end = context.size();
        // The latest utterance is sent separately as the message to classify.
        if (end > 0 && context.get(end - 1).role() == TurnRole.USER
                && context.get(end - 1).content().strip().equals(text)) {
            end--;
        }
        for (Turn t : context.subList(0, end)) {
            ChatMessage m = toMessage(t);
            if (m != null) {
                messages.add(m);
            }
        }
        messages.add(UserMessage.from(IntentPrompts.request(text)));
        return messages;
    }

    static ChatMessage toMessage(Turn turn) {
        if (turn.content().isBlank()) {
            return null;
        }
        return switch (turn.role()) {
            case USER -> UserMessage.from(turn.content());
            case ASSISTANT -> AiMessage.from(turn.content());
            case SYSTEM -> null;
        };
    }
}
