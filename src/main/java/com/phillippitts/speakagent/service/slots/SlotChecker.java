package com.phillippitts.speakagent.service.slots;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes which required slots are missing and which present values still need resolution.
 *
 * <p>Pure function of (intent, slot values): no state, no randomness.
 */
public class SlotChecker {

    private final SlotSchema schema;

    public SlotChecker(SlotSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public Result check(String intent, Map<String, String> entities) {
        Map<String, String> values = entities == null ? Map.of() : entities;
        List<String> missing = new ArrayList<>();
        for (String slot : schema.requiredSlots(intent)) {
            if (isBlank(values.get(slot))) {
                missing.add(slot);
            }
        }
        // Resolution is re-evaluated every turn, so present values are always marked again.
        List<String> unresolved = new ArrayList<>();
        for (String slot : schema.allSlots(intent)) {
            if (schema.isResolvable(slot) && !isBlank(values.get(slot))) {
                unresolved.add(slot);
            }
        }
        return new Result(List.copyOf(missing), List.copyOf(unresolved));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * @param missing    required slots absent or empty, in schema order
     * @param unresolved present slots that must be resolved before execution
     */
    public record Result(List<String> missing, List<String> unresolved) {

        public boolean isComplete() {
            return missing.isEmpty() && unresolved.isEmpty();
        }
    }
}
