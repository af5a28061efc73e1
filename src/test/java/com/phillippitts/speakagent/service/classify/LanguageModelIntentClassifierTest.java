package com.phillippitts.speakagent.service.classify;

import com.phillippitts.speakagent.domain.IntentGuess;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.exception.ClassificationException;
import com.phillippitts.speakagent.exception.IntentParseException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LanguageModelIntentClassifierTest {

    private ChatLanguageModel model;
    private LanguageModelIntentClassifier classifier;

    @BeforeEach
    void setUp() {
        model = mock(ChatLanguageModel.class);
        classifier = new LanguageModelIntentClassifier(model, new IntentGuessParser());
    }

    @Test
    void parsesModelReply() {
        when(model.generate(anyList())).thenReturn(Response.from(AiMessage.from(
                "{\"intent\":\"set_timer\",\"confidence\":0.9,\"entities\":{\"duration\":\"5 minutes\"}}")));

        IntentGuess g = classifier.classify(List.of(Turn.user("timer 5 minutes")), "timer 5 minutes");

        assertThat(g.intent()).isEqualTo(Intents.SET_TIMER);
        assertThat(g.slots()).containsEntry("duration", "5 minutes");
    }

    @Test
    void modelFailureBecomesClassificationException() {
        when(model.generate(anyList())).thenThrow(new RuntimeException("401 unauthorized"));

        assertThatThrownBy(() -> classifier.classify(List.of(), "hi"))
                .isInstanceOf(ClassificationException.class)
                .isNotInstanceOf(IntentParseException.class)
                .hasMessageContaining("401 unauthorized");
    }

    @Test
    void proseReplyBecomesParseException() {
        when(model.generate(anyList())).thenReturn(Response.from(AiMessage.from("You want a timer.")));

        assertThatThrownBy(() -> classifier.classify(List.of(), "timer"))
                .isInstanceOf(IntentParseException.class);
    }

    @Test
    void buildsSystemHistoryAndRequestWithoutDuplicatingLatestUtterance() {
        List<Turn> history = List.of(
                Turn.user("send a message to mom"),
                Turn.assistant("What should the message say?"),
                Turn.user("I'm late"));

        List<ChatMessage> messages = classifier.buildMessages(history, "I'm late");

        assertThat(messages).hasSize(4);
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        assertThat(messages.get(1)).isInstanceOf(UserMessage.class);
        assertThat(messages.get(2)).isInstanceOf(AiMessage.class);
        assertThat(((UserMessage) messages.get(3)).singleText()).contains("I'm late");
    }

    @Test
    void blankTurnsAreSkipped() {
        List<ChatMessage> messages = classifier.buildMessages(
                List.of(Turn.user(""), Turn.assistant("Hi! How can I help?")), "open chrome");

        assertThat(messages).hasSize(3);
        assertThat(messages.get(1)).isInstanceOf(AiMessage.class);
    }

    @Test
    void hasStableName() {
        assertThat(classifier.name()).isEqualTo("language-model");
    }
}
