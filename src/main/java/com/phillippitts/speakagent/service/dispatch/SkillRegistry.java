package com.phillippitts.speakagent.service.dispatch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable intent-to-skill table, built once at startup and passed to the dispatcher.
 */
public final class SkillRegistry {

    private final Map<String, Skill> skills;

    public SkillRegistry(List<? extends Skill> skills) {
        Map<String, Skill> byIntent = new LinkedHashMap<>();
        for (Skill s : skills) {
            Skill previous = byIntent.putIfAbsent(s.intent(), s);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate skill for intent '" + s.intent() + "': "
                        + previous.getClass().getSimpleName() + " and " + s.getClass().getSimpleName());
            }
        }
        this.skills = Collections.unmodifiableMap(byIntent);
    }

    public static SkillRegistry empty() {
        return new SkillRegistry(List.of());
    }

    public Optional<Skill> lookup(String intent) {
        return Optional.ofNullable(intent == null ? null : skills.get(intent));
    }
}
