package com.phillippitts.speakagent.service.resolve;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.DisambiguationOption;
import com.phillippitts.speakagent.domain.EntityCandidate;
import com.phillippitts.speakagent.service.clarify.ClarificationCatalog;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Resolves slot values that name a real-world referent (a contact) into a single candidate.
 *
 * <p>Per unresolved slot:
 * <ul>
 *   <li>no candidate: a disambiguation option with an empty list and a "not found" prompt</li>
 *   <li>one candidate: written to the resolved entities silently</li>
 *   <li>several candidates: a disambiguation option listing them with a "which one" prompt</li>
 * </ul>
 * Literal slot values are never modified; resolutions live only in the resolved entities.
 * A failed lookup counts as no candidate, so the user is asked who they meant.
 */
public class EntityResolver {
    private static final Logger LOG = LogManager.getLogger(EntityResolver.class);

    private final ContactDirectory directory;
    private final ExternalCallGuard guard;

    public EntityResolver(ContactDirectory directory, ExternalCallGuard guard) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.guard = Objects.requireNonNull(guard, "guard");
    }

    /**
     * Resolves every slot in the session's unresolved list.
     *
     * @return {@link DialogueEvent#ENTITIES_RESOLVED} when every slot resolved, otherwise
     *         {@link DialogueEvent#DISAMBIGUATION_NEEDED}
     */
    public DialogueEvent resolve(DialogueSession session) {
        session.clearDisambiguation();
        for (String slot : session.getUnresolvedEntities()) {
            String query = session.getEntities().get(slot);
            if (query == null || query.isBlank()) {
                continue;
            }
            List<EntityCandidate> candidates = lookup(session.getOwnerId(), slot, query);
            if (candidates.size() == 1) {
                EntityCandidate only = candidates.get(0);
                session.putResolvedEntity(slot, only.displayName());
                session.putResolvedEntity(slot + DialogueSession.RESOLVED_ID_SUFFIX, only.id());
                LOG.debug("Resolved slot '{}' to contact id={}", slot, only.id());
            } else if (candidates.isEmpty()) {
                session.addDisambiguationOption(new DisambiguationOption(slot, query, List.of(),
                        ClarificationCatalog.notFound(query, session.getInputLanguage())));
            } else {
                session.addDisambiguationOption(new DisambiguationOption(slot, query, candidates,
                        ClarificationCatalog.whichOne(candidates, session.getInputLanguage())));
            }
        }
        if (!session.isNeedsUserDisambiguation()) {
            session.setUnresolvedEntities(List.of());
            return DialogueEvent.ENTITIES_RESOLVED;
        }
        // Keep the unresolved list so the next turn retries resolution.
        return DialogueEvent.DISAMBIGUATION_NEEDED;
    }

    private List<EntityCandidate> lookup(String ownerId, String slot, String query) {
        try {
            List<EntityCandidate> found = guard.call("resolve-" + slot,
                    () -> directory.resolveCandidates(ownerId, query));
            return found == null ? List.of() : found;
        } catch (RuntimeException e) {
            LOG.warn("Contact lookup failed for slot '{}': {}", slot, e.getMessage());
            return List.of();
        }
    }
}
