package com.phillippitts.speakagent.service.dispatch;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.service.slots.SlotSchema;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for skills implementing required-slot validation.
 *
 * <p>This class implements the Template Method pattern: {@link #execute(String, Map)} fails
 * fast when a required slot of the intent is absent or blank and otherwise delegates to
 * {@link #doExecute(String, Map)}, where every required slot is guaranteed to be present.
 * Required slots come from the {@link SlotSchema}, so skill and negotiation agree on them.
 */
public abstract class AbstractSkill implements Skill {

    private final String intent;
    private final List<String> requiredSlots;

    protected AbstractSkill(String intent, SlotSchema schema) {
        this.intent = Objects.requireNonNull(intent, "intent");
        this.requiredSlots = Objects.requireNonNull(schema, "schema").requiredSlots(intent);
    }

    @Override
    public final String intent() {
        return intent;
    }

    @Override
    public final ActionResult execute(String ownerId, Map<String, String> slots) {
        Map<String, String> values = slots == null ? Map.of() : slots;
        List<String> missing = requiredSlots.stream()
                .filter(s -> values.get(s) == null || values.get(s).isBlank())
                .toList();
        if (!missing.isEmpty()) {
            return ActionResult.failure("missing required information: " + String.join(", ", missing));
        }
        return doExecute(ownerId, values);
    }

    /**
     * Performs the action. All required slots are present and non-blank.
     */
    protected abstract ActionResult doExecute(String ownerId, Map<String, String> slots);

    protected static String slot(Map<String, String> slots, String name, String defaultValue) {
        String v = slots.get(name);
        return v == null || v.isBlank() ? defaultValue : v.trim();
    }
}
