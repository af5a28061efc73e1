package com.phillippitts.speakagent.service.session;

import com.phillippitts.speakagent.domain.DialogueSession;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryDialogueSessionStoreTest {

    private final InMemoryDialogueSessionStore store = new InMemoryDialogueSessionStore();

    @Test
    void saveReplacesSessionWithSameId() {
        DialogueSession first = new DialogueSession("s-1", "o", 3);
        DialogueSession second = first.copy();
        store.save(first);
        store.save(second);

        assertThat(store.find("s-1")).containsSame(second);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void removeReportsWhetherSessionExisted() {
        store.save(new DialogueSession("s-1", "o", 3));

        assertThat(store.remove("s-1")).isTrue();
        assertThat(store.remove("s-1")).isFalse();
        assertThat(store.remove(null)).isFalse();
        assertThat(store.find("s-1")).isEmpty();
        assertThat(store.find(null)).isEmpty();
    }
}
