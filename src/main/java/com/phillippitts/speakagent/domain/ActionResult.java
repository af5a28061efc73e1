package com.phillippitts.speakagent.domain;

import java.util.Map;

/**
 * Outcome of dispatching an intent to a skill.
 *
 * @param success whether the action was carried out
 * @param message human readable outcome, may be null
 * @param data    skill specific payload
 */
public record ActionResult(boolean success, String message, Map<String, Object> data) {

    public ActionResult {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ActionResult success(String message, Map<String, Object> data) {
        return new ActionResult(true, message, data);
    }

    public static ActionResult failure(String message) {
        return new ActionResult(false, message, Map.of());
    }
}
