package com.phillippitts.speakagent.domain;

import java.util.List;
import java.util.Objects;

/**
 * A slot the user must help resolve, with the candidates found for it.
 *
 * @param entity     slot name, e.g. {@code recipient}
 * @param query      the value the user gave for the slot
 * @param candidates candidates found; empty when nothing matched
 * @param prompt     question to read to the user verbatim
 */
public record DisambiguationOption(
        String entity,
        String query,
        List<EntityCandidate> candidates,
        String prompt
) {

    public DisambiguationOption {
        Objects.requireNonNull(entity, "entity must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        query = query == null ? "" : query;
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
