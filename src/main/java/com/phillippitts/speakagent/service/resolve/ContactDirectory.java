package com.phillippitts.speakagent.service.resolve;

import com.phillippitts.speakagent.domain.EntityCandidate;

import java.util.List;

/**
 * Looks up the contacts a spoken name may refer to.
 *
 * <p>Implementations may block on I/O; the resolver bounds each call with a timeout.
 */
public interface ContactDirectory {

    /**
     * Returns the owner's contacts matching {@code query}, best match first.
     *
     * @param ownerId owner of the session (the contact book to search)
     * @param query   name as spoken by the user
     * @return matching candidates; empty when nothing matched, never null
     */
    List<EntityCandidate> resolveCandidates(String ownerId, String query);
}
