package com.phillippitts.speakagent.presentation.controller;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.IntentGuess;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.exception.SessionBusyException;
import com.phillippitts.speakagent.exception.SessionNotFoundException;
import com.phillippitts.speakagent.service.dialogue.TurnReply;
import com.phillippitts.speakagent.service.session.ConversationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DialogueController.class)
class DialogueControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ConversationService conversationService;

    @Test
    void createsSession() throws Exception {
        when(conversationService.createSession("owner-1")).thenReturn(new DialogueSession("s-1", "owner-1", 3));

        mvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"owner-1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.taskStatus").value("IDLE"))
                .andExpect(jsonPath("$.turns").isEmpty());
    }

    @Test
    void blankOwnerIsRejected() throws Exception {
        mvc.perform(post("/api/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"))
                .andExpect(jsonPath("$.details").value("ownerId must not be blank"));

        verify(conversationService, never()).createSession(anyString());
    }

    @Test
    void turnReturnsReplyAndStatus() throws Exception {
        DialogueSession after = new DialogueSession("s-1", "o", 3);
        after.setIntent(IntentGuess.of("send_message", 0.9, Map.of("recipient", "mom")));
        after.apply(DialogueEvent.CLARIFICATION_REQUESTED);
        after.appendTurn(Turn.user("text mom"));
        after.appendTurn(Turn.assistant("What should the message say?"));
        when(conversationService.processTurn("s-1", "text mom"))
                .thenReturn(new TurnReply(after, "What should the message say?", true));

        mvc.perform(post("/api/sessions/s-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"text mom\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reply").value("What should the message say?"))
                .andExpect(jsonPath("$.shouldSpeak").value(true))
                .andExpect(jsonPath("$.taskStatus").value("WAITING_USER_INPUT"))
                .andExpect(jsonPath("$.intent").value("send_message"));
    }

    @Test
    void missingTextIsRejected() throws Exception {
        mvc.perform(post("/api/sessions/s-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void malformedBodyIsRejected() throws Exception {
        mvc.perform(post("/api/sessions/s-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Request body is missing or malformed"));
    }

    @Test
    void busySessionIsConflict() throws Exception {
        when(conversationService.processTurn("s-1", "again")).thenThrow(new SessionBusyException("s-1", 2000));

        mvc.perform(post("/api/sessions/s-1/turns")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"again\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        when(conversationService.getSession("nope")).thenThrow(new SessionNotFoundException("nope"));

        mvc.perform(get("/api/sessions/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Session not found"));
    }

    @Test
    void endingSessionReturnsNoContent() throws Exception {
        mvc.perform(delete("/api/sessions/s-1"))
                .andExpect(status().isNoContent());
        verify(conversationService).endSession("s-1");

        doThrow(new SessionNotFoundException("s-2")).when(conversationService).endSession("s-2");
        mvc.perform(delete("/api/sessions/s-2"))
                .andExpect(status().isNotFound());
    }
}
