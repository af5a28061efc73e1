package com.phillippitts.speakagent.service.resolve;

import com.phillippitts.speakagent.domain.DialogueEvent;
import com.phillippitts.speakagent.domain.DialogueSession;
import com.phillippitts.speakagent.domain.EntityCandidate;
import com.phillippitts.speakagent.domain.Language;
import com.phillippitts.speakagent.exception.ExternalCallException;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EntityResolverTest {

    private InMemoryContactDirectory directory;
    private EntityResolver resolver;

    @BeforeEach
    void setUp() {
        directory = new InMemoryContactDirectory();
        directory.add("*", EntityCandidate.of("c-mom", "Maria Lopez"), List.of("mom"));
        directory.add("*", EntityCandidate.of("c-ana1", "Ana Diaz"), List.of());
        directory.add("*", EntityCandidate.of("c-ana2", "Ana Ruiz"), List.of());
        resolver = new EntityResolver(directory, ExternalCallGuard.DIRECT);
    }

    private static DialogueSession sessionWithRecipient(String recipient) {
        DialogueSession s = new DialogueSession("s", "o", 3);
        s.setInputLanguage(Language.EN);
        s.replaceEntities(Map.of("recipient", recipient, "message_content", "hi"));
        s.setUnresolvedEntities(List.of("recipient"));
        return s;
    }

    @Test
    void singleCandidateResolvesSilently() {
        DialogueSession s = sessionWithRecipient("mom");

        assertThat(resolver.resolve(s)).isEqualTo(DialogueEvent.ENTITIES_RESOLVED);
        assertThat(s.getResolvedEntities())
                .containsEntry("recipient", "Maria Lopez")
                .containsEntry("recipient_id", "c-mom");
        assertThat(s.getEntities()).containsEntry("recipient", "mom");
        assertThat(s.getUnresolvedEntities()).isEmpty();
        assertThat(s.isNeedsUserDisambiguation()).isFalse();
    }

    @Test
    void severalCandidatesAreListedInOrder() {
        DialogueSession s = sessionWithRecipient("Ana");

        assertThat(resolver.resolve(s)).isEqualTo(DialogueEvent.DISAMBIGUATION_NEEDED);
        assertThat(s.getDisambiguationOptions()).singleElement().satisfies(o -> {
            assertThat(o.entity()).isEqualTo("recipient");
            assertThat(o.candidates()).hasSize(2);
            assertThat(o.prompt()).isEqualTo(
                    "I found several contacts: 1) Ana Diaz, 2) Ana Ruiz. Which one do you mean?");
        });
        assertThat(s.getUnresolvedEntities()).containsExactly("recipient");
        assertThat(s.getResolvedEntities()).isEmpty();
    }

    @Test
    void unknownNameAsksWhoWasMeant() {
        DialogueSession s = sessionWithRecipient("Zed");

        assertThat(resolver.resolve(s)).isEqualTo(DialogueEvent.DISAMBIGUATION_NEEDED);
        assertThat(s.getDisambiguationOptions().get(0).prompt())
                .isEqualTo("I couldn't find any contact named 'Zed'. Who do you mean?");
        assertThat(s.getDisambiguationOptions().get(0).candidates()).isEmpty();
    }

    @Test
    void failedLookupCountsAsNoCandidate() {
        EntityResolver failing = new EntityResolver((owner, query) -> {
            throw new ExternalCallException("directory down", "contacts");
        }, ExternalCallGuard.DIRECT);
        DialogueSession s = sessionWithRecipient("mom");

        assertThat(failing.resolve(s)).isEqualTo(DialogueEvent.DISAMBIGUATION_NEEDED);
        assertThat(s.getDisambiguationOptions()).hasSize(1);
    }

    @Test
    void spanishPromptFollowsInputLanguage() {
        DialogueSession s = sessionWithRecipient("Ana");
        s.setInputLanguage(Language.ES);

        resolver.resolve(s);

        assertThat(s.getDisambiguationOptions().get(0).prompt())
                .startsWith("Encontré varios contactos: 1) Ana Diaz")
                .endsWith("¿A cuál te referís?");
    }
}
