package com.phillippitts.speakagent.service.dialogue.event;

import java.time.Instant;

/** Published when dispatch ends in failure: no handler, a failure result, or a fault. */
public record SkillFailedEvent(String sessionId, String intent, String error, Instant at) { }
