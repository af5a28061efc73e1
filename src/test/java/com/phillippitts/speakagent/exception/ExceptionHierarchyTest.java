package com.phillippitts.speakagent.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void speakAgentExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        SpeakAgentException ex = new SpeakAgentException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void externalCallExceptionShouldIncludeCallName() {
        ExternalCallException ex = new ExternalCallException("Timed out after 100 ms", "classify");

        assertThat(ex.getMessage()).contains("Timed out").contains("classify");
        assertThat(ex.getCallName()).isEqualTo("classify");
        assertThat(new ExternalCallException("boom").getCallName()).isEqualTo("unknown");
    }

    @Test
    void intentParseExceptionKeepsRawReplyAndIsAClassificationFailure() {
        IntentParseException ex = new IntentParseException("not json", "{oops");

        assertThat(ex.getRawReply()).isEqualTo("{oops");
        assertThat(ex).isInstanceOf(ClassificationException.class);
    }

    @Test
    void sessionExceptionsShouldIncludeSessionId() {
        SessionBusyException busy = new SessionBusyException("s-1", 200);
        SessionNotFoundException missing = new SessionNotFoundException("s-2");

        assertThat(busy.getMessage()).contains("s-1").contains("200ms");
        assertThat(busy.getWaitedMs()).isEqualTo(200);
        assertThat(missing.getMessage()).isEqualTo("Session not found: s-2");
        assertThat(missing.getSessionId()).isEqualTo("s-2");
    }

    @Test
    void allExceptionsShouldBeRuntimeExceptions() {
        assertThat(new SpeakAgentException("test")).isInstanceOf(RuntimeException.class);
        assertThat(new ClassificationException("test")).isInstanceOf(SpeakAgentException.class);
        assertThat(new ExternalCallException("test")).isInstanceOf(SpeakAgentException.class);
        assertThat(new SessionBusyException("s", 1)).isInstanceOf(SpeakAgentException.class);
        assertThat(new SessionNotFoundException("s")).isInstanceOf(SpeakAgentException.class);
    }
}
