package com.phillippitts.speakagent.service.session;

import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.exception.SessionBusyException;
import com.phillippitts.speakagent.exception.SessionNotFoundException;
import com.phillippitts.speakagent.service.dialogue.DialogueEngine;
import com.phillippitts.speakagent.service.dialogue.TurnReply;
import com.phillippitts.speakagent.service.dialogue.event.TurnCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns dialogue sessions and runs their turns one at a time.
 *
 * <p>Turns of the same session are serialised with a per-session lock acquired with a bounded
 * wait; turns of different sessions run in parallel. The engine returns a new session value
 * which is committed to the store only when the turn finished, so an interrupted turn leaves
 * the stored session unchanged.
 */
public class ConversationService {
    private static final Logger LOG = LogManager.getLogger(ConversationService.class);

    private final DialogueEngine engine;
    private final DialogueSessionStore store;
    private final ApplicationEventPublisher publisher;
    private final int maxClarifications;
    private final long lockTimeoutMs;
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ConversationService(DialogueEngine engine,
                               DialogueSessionStore store,
                               ApplicationEventPublisher publisher,
                               int maxClarifications,
                               long lockTimeoutMs) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.store = Objects.requireNonNull(store, "store");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.maxClarifications = maxClarifications;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    public DialogueSession createSession(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId must not be blank");
        }
        DialogueSession session = new DialogueSession(UUID.randomUUID().toString(), ownerId, maxClarifications);
        store.save(session);
        LOG.info("Created session {} for owner {}", session.getSessionId(), ownerId);
        return session;
    }

    /**
     * @throws SessionNotFoundException if no session has that id
     */
    public DialogueSession getSession(String sessionId) {
        return store.find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    /**
     * Runs one turn and commits the resulting session.
     *
     * @throws SessionNotFoundException if no session has that id, or it ended while waiting
     * @throws SessionBusyException     if another turn of the session holds the lock too long
     */
    public TurnReply processTurn(String sessionId, String utterance) {
        getSession(sessionId);
        ReentrantLock lock = acquire(sessionId);
        try {
            DialogueSession current = getSession(sessionId);
            long start = System.nanoTime();
            TurnReply reply = engine.processTurn(current, utterance);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
            store.save(reply.session());
            publisher.publishEvent(new TurnCompletedEvent(sessionId, reply.session().getIntentName(),
                    reply.session().getTaskStatus(), elapsedMs, Instant.now()));
            return reply;
        } finally {
            release(sessionId, lock);
        }
    }

    /**
     * Removes the session. Waits for a running turn of the session so the turn cannot commit
     * the session back after it ended.
     *
     * @throws SessionNotFoundException if no session has that id
     * @throws SessionBusyException     if a running turn holds the lock too long
     */
    public void endSession(String sessionId) {
        getSession(sessionId);
        ReentrantLock lock = acquire(sessionId);
        try {
            if (!store.remove(sessionId)) {
                throw new SessionNotFoundException(sessionId);
            }
            LOG.info("Ended session {}", sessionId);
        } finally {
            release(sessionId, lock);
        }
    }

    private ReentrantLock acquire(String sessionId) {
        ReentrantLock lock = locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SessionBusyException(sessionId, lockTimeoutMs);
        }
        if (!acquired) {
            LOG.warn("Session {} busy; rejected after {}ms", sessionId, lockTimeoutMs);
            throw new SessionBusyException(sessionId, lockTimeoutMs);
        }
        return lock;
    }

    /** Unlocks, and drops the lock once its session is gone. */
    private void release(String sessionId, ReentrantLock lock) {
        try {
            if (store.find(sessionId).isEmpty()) {
                locks.remove(sessionId, lock);
            }
        } finally {
            lock.unlock();
        }
    }

    int lockCount() {
        return locks.size();
    }
}
