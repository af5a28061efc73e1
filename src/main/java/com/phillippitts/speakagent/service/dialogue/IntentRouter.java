package com.phillippitts.speakagent.service.dialogue;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.Intents;

import java.util.Set;

/**
 * Branches on the detected intent name. Order matters: cancel, confirm, system action,
 * conversation, then slot negotiation for everything else.
 */
public class IntentRouter {

    private final Set<String> systemActionIntents;

    public IntentRouter(Set<String> systemActionIntents) {
        this.systemActionIntents = Set.copyOf(systemActionIntents);
    }

    public DialogueEvent route(String intent) {
        if (Intents.CANCEL.equals(intent)) {
            return DialogueEvent.ROUTED_TO_CANCEL;
        }
        if (Intents.CONFIRM.equals(intent)) {
            return DialogueEvent.ROUTED_TO_CONFIRM;
        }
        if (systemActionIntents.contains(intent)) {
            return DialogueEvent.ROUTED_TO_SYSTEM_ACTION;
        }
        if (intent == null || Intents.CONVERSATIONAL.contains(intent)) {
            return DialogueEvent.ROUTED_TO_REPLY;
        }
        return DialogueEvent.ROUTED_TO_SLOT_CHECK;
    }
}
