package com.phillippitts.speakagent.service.dialogue.event;

import com.phillippitts.speakagent.domain.TaskStatus;

import java.time.Instant;

/**
 * Published after a turn has been committed to the session store.
 *
 * @param sessionId session the turn belongs to
 * @param intent    intent of the turn ({@code unknown} when none)
 * @param status    task status the turn ended in
 * @param elapsedMs processing time
 * @param at        commit time
 */
public record TurnCompletedEvent(String sessionId, String intent, TaskStatus status, long elapsedMs,
                                 Instant at) { }
