package com.phillippitts.speakagent.domain;

import java.util.Map;
import java.util.Objects;

/**
 * A concrete referent (usually a contact) a spoken slot value may stand for.
 *
 * @param id          stable identifier in the lookup source
 * @param displayName name read back to the user when disambiguating
 * @param attributes  extra lookup data such as a phone number
 */
public record EntityCandidate(String id, String displayName, Map<String, String> attributes) {

    public EntityCandidate {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(displayName, "displayName must not be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static EntityCandidate of(String id, String displayName) {
        return new EntityCandidate(id, displayName, Map.of());
    }
}
