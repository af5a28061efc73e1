package com.phillippitts.speakagent.service.resolve;

import com.phillippitts.speakagent.config.properties.ContactProperties;
import com.phillippitts.speakagent.domain.EntityCandidate;
import com.phillippitts.speakagent.util.TextFolding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Contact directory kept in memory and seeded from {@link ContactProperties}.
 *
 * <p>A contact matches when the folded query (case and accents ignored) equals its full
 * display name, one word of the display name, or one of its aliases. Contacts owned by
 * {@value #SHARED_OWNER} are visible to every owner.
 */
public class InMemoryContactDirectory implements ContactDirectory {
    private static final Logger LOG = LogManager.getLogger(InMemoryContactDirectory.class);

    public static final String SHARED_OWNER = "*";

    private final List<Contact> contacts = new CopyOnWriteArrayList<>();

    public InMemoryContactDirectory() {
    }

    public InMemoryContactDirectory(ContactProperties properties) {
        Objects.requireNonNull(properties, "properties");
        for (ContactProperties.Entry e : properties.getEntries()) {
            if (e.getId() == null || e.getDisplayName() == null) {
                LOG.warn("Skipping contact entry without id or display name: id={}", e.getId());
                continue;
            }
            Map<String, String> attributes = new LinkedHashMap<>();
            if (e.getPhone() != null && !e.getPhone().isBlank()) {
                attributes.put("phone", e.getPhone());
            }
            add(e.getOwner(), new EntityCandidate(e.getId(), e.getDisplayName(), attributes), e.getAliases());
        }
        LOG.info("Contact directory seeded with {} contacts", contacts.size());
    }

    /**
     * Registers a contact for an owner.
     */
    public void add(String ownerId, EntityCandidate candidate, List<String> aliases) {
        Objects.requireNonNull(candidate, "candidate");
        String owner = ownerId == null || ownerId.isBlank() ? SHARED_OWNER : ownerId;
        List<String> folded = new ArrayList<>();
        if (aliases != null) {
            aliases.stream().map(TextFolding::fold).filter(a -> !a.isEmpty()).forEach(folded::add);
        }
        contacts.add(new Contact(owner, candidate, List.copyOf(folded)));
    }

    @Override
    public List<EntityCandidate> resolveCandidates(String ownerId, String query) {
        String q = TextFolding.fold(query);
        if (q.isEmpty()) {
            return List.of();
        }
        List<EntityCandidate> exact = new ArrayList<>();
        List<EntityCandidate> partial = new ArrayList<>();
        for (Contact c : contacts) {
            if (!c.visibleTo(ownerId)) {
                continue;
            }
            String name = TextFolding.fold(c.candidate().displayName());
            if (name.equals(q) || c.aliases().contains(q)) {
                exact.add(c.candidate());
            } else if (TextFolding.words(name).contains(q)) {
                partial.add(c.candidate());
            }
        }
        // A full-name or alias hit is unambiguous even if other contacts share a first name.
        return exact.isEmpty() ? List.copyOf(partial) : List.copyOf(exact);
    }

    private record Contact(String owner, EntityCandidate candidate, List<String> aliases) {
        boolean visibleTo(String ownerId) {
            return SHARED_OWNER.equals(owner) || owner.equals(ownerId);
        }
    }
}
