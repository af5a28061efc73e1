package com.phillippitts.speakagent.service.dispatch;

import com.phillippitts.speakagent.domain.ActionResult;

import java.util.Map;

/**
 * Executable capability that carries out the real-world action of one intent.
 *
 * <p>Skills may block and may throw; the dispatcher converts a thrown fault into a failure
 * result, so a skill never ends a turn.
 */
public interface Skill {

    /** Intent name this skill handles, e.g. {@code send_message}. */
    String intent();

    /**
     * @param ownerId owner of the session on whose behalf the action runs
     * @param slots   literal slot values overlaid with resolved values
     * @return outcome; a failure result carries the reason as its message
     */
    ActionResult execute(String ownerId, Map<String, String> slots);
}
