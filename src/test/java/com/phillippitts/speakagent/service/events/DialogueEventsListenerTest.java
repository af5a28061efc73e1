package com.phillippitts.speakagent.service.events;

import com.phillippitts.speakagent.domain.TaskStatus;
import com.phillippitts.speakagent.service.dialogue.event.ClassificationFailedEvent;
import com.phillippitts.speakagent.service.dialogue.event.SkillFailedEvent;
import com.phillippitts.speakagent.service.dialogue.event.TurnCompletedEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class DialogueEventsListenerTest {

    @Test
    void throttlesRepeatLogs() {
        DialogueEventsListener l = new DialogueEventsListener();

        assertThat(l.shouldLog("skill-send_message")).isTrue();
        assertThat(l.shouldLog("skill-send_message")).isFalse();
        assertThat(l.shouldLog("skill-set_timer")).isTrue();
    }

    @Test
    void handlersDoNotThrow() {
        DialogueEventsListener l = new DialogueEventsListener();

        assertThatCode(() -> {
            l.onClassificationFailed(new ClassificationFailedEvent("s", "llm", "parse", null, Instant.now()));
            l.onSkillFailed(new SkillFailedEvent("s", "send_message", "unsupported platform: fax", Instant.now()));
            l.onTurnCompleted(new TurnCompletedEvent("s", "greeting", TaskStatus.IDLE, 12, Instant.now()));
        }).doesNotThrowAnyException();
    }
}
