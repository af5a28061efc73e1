package com.phillippitts.speakagent.service.dialogue.event;

import java.time.Instant;

/** Published when the classifier could not classify an utterance (reason: parse or error). */
public record ClassificationFailedEvent(String sessionId, String classifier, String reason, String detail,
                                        Instant at) { }
