package com.phillippitts.speakagent.service.slots;

import com.phillippitts.speakagent.domain.Intents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static table of required and optional slots per intent.
 *
 * <p>Required slots are kept in declaration order; that order decides which missing slot
 * is asked about first. Instances are immutable and safe to share between sessions.
 */
public final class SlotSchema {

    private final Map<String, List<String>> required;
    private final Map<String, List<String>> optional;
    private final Set<String> resolvableSlots;

    private SlotSchema(Map<String, List<String>> required,
                       Map<String, List<String>> optional,
                       Set<String> resolvableSlots) {
        this.required = copy(required);
        this.optional = copy(optional);
        this.resolvableSlots = Set.copyOf(resolvableSlots);
    }

    /**
     * Schema of the built-in intents. Only {@code recipient} is resolved against contacts.
     */
    public static SlotSchema standard() {
        return builder()
                .intent(Intents.SEND_MESSAGE, List.of("recipient", "message_content"), List.of("platform"))
                .intent(Intents.SET_REMINDER, List.of("reminder_text", "datetime"), List.of("recurrence"))
                .intent(Intents.CREATE_NOTE, List.of("note_content"), List.of("title", "tags"))
                .intent(Intents.OPEN_APP, List.of("app_name"), List.of())
                .intent(Intents.OPEN_URL, List.of("url"), List.of())
                .intent(Intents.SEARCH_WEB, List.of("query"), List.of())
                .intent(Intents.SET_TIMER, List.of("duration"), List.of())
                .resolvable("recipient")
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Required slots in declaration order; empty for intents without a schema entry. */
    public List<String> requiredSlots(String intent) {
        return required.getOrDefault(intent, List.of());
    }

    public List<String> optionalSlots(String intent) {
        return optional.getOrDefault(intent, List.of());
    }

    /** Whether values of this slot name a real-world referent that must be looked up. */
    public boolean isResolvable(String slot) {
        return resolvableSlots.contains(slot);
    }

    /** Every slot of the intent, required first. */
    public List<String> allSlots(String intent) {
        List<String> all = new ArrayList<>(requiredSlots(intent));
        all.addAll(optionalSlots(intent));
        return List.copyOf(all);
    }

    private static Map<String, List<String>> copy(Map<String, List<String>> source) {
        Map<String, List<String>> m = new LinkedHashMap<>();
        source.forEach((k, v) -> m.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(m);
    }

    public static final class Builder {
        private final Map<String, List<String>> required = new LinkedHashMap<>();
        private final Map<String, List<String>> optional = new LinkedHashMap<>();
        private final Set<String> resolvable = new HashSet<>();

        private Builder() {
        }

        public Builder intent(String intent, List<String> requiredSlots, List<String> optionalSlots) {
            Objects.requireNonNull(intent, "intent must not be null");
            if (required.containsKey(intent)) {
                throw new IllegalArgumentException("Duplicate slot schema for intent: " + intent);
            }
            required.put(intent, List.copyOf(requiredSlots));
            optional.put(intent, List.copyOf(optionalSlots));
            return this;
        }

        public Builder resolvable(String slot) {
            resolvable.add(Objects.requireNonNull(slot, "slot must not be null"));
            return this;
        }

        public SlotSchema build() {
            return new SlotSchema(required, optional, resolvable);
        }
    }
}
