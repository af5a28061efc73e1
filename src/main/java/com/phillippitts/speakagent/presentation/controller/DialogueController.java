package com.phillippitts.speakagent.presentation.controller;

import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.Turn;
import com.phillippitts.speakagent.service.dialogue.TurnReply;
import com.phillippitts.speakagent.service.session.ConversationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Thin HTTP adapter over {@link ConversationService}. Text in, text out; audio stays with the client.
 */
@RestController
@RequestMapping("/api/sessions")
class DialogueController {

    private static final Logger LOG = LogManager.getLogger(DialogueController.class);

    private final ConversationService conversationService;

    DialogueController(ConversationService conversationService) {
        this.conversationService = conversationService;
    }

    @PostMapping
    ResponseEntity<SessionView> create(@Valid @RequestBody CreateSessionRequest request) {
        DialogueSession session = conversationService.createSession(request.ownerId());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionView.of(session));
    }

    @GetMapping("/{sessionId}")
    ResponseEntity<SessionView> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(SessionView.of(conversationService.getSession(sessionId)));
    }

    @PostMapping("/{sessionId}/turns")
    ResponseEntity<TurnResponse> turn(@PathVariable String sessionId, @Valid @RequestBody TurnRequest request) {
        TurnReply reply = conversationService.processTurn(sessionId, request.text());
        DialogueSession session = reply.session();
        LOG.debug("Turn reply for {}: status={}", sessionId, session.getTaskStatus());
        return ResponseEntity.ok(new TurnResponse(reply.replyText(), reply.shouldSpeak(),
                session.getTaskStatus().name(), session.getIntentName()));
    }

    @DeleteMapping("/{sessionId}")
    ResponseEntity<Void> end(@PathVariable String sessionId) {
        conversationService.endSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    record CreateSessionRequest(@NotBlank(message = "ownerId must not be blank") String ownerId) {
    }

    record TurnRequest(@NotNull(message = "text is required") String text) {
    }

    record TurnResponse(String reply, boolean shouldSpeak, String taskStatus, String intent) {
    }

    record TurnView(String role, String content) {
        static TurnView of(Turn turn) {
            return new TurnView(turn.role().name(), turn.content());
        }
    }

    record SessionView(String sessionId,
                       String ownerId,
                       String taskStatus,
                       String intent,
                       int turnCount,
                       int clarificationCount,
                       List<String> missingEntities,
                       boolean needsUserDisambiguation,
                       List<TurnView> turns) {

        static SessionView of(DialogueSession s) {
            return new SessionView(s.getSessionId(), s.getOwnerId(), s.getTaskStatus().name(),
                    s.getIntent() == null ? null : s.getIntentName(), s.getTurnCount(),
                    s.getClarificationCount(), s.getMissingEntities(), s.isNeedsUserDisambiguation(),
                    s.getTurns().stream().map(TurnView::of).toList());
        }
    }
}
