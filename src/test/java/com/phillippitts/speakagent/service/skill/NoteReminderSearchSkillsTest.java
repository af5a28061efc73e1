package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.service.slots.SlotSchema;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NoteReminderSearchSkillsTest {

    private final SlotSchema schema = SlotSchema.standard();

    @Test
    void noteGetsDefaultTitleAndSplitTags() {
        NoteSkill skill = new NoteSkill(schema);

        ActionResult r = skill.execute("o", Map.of("note_content", "buy milk", "tags", "home, , shopping"));

        assertThat(r.success()).isTrue();
        assertThat(r.data()).containsEntry("title", NoteSkill.DEFAULT_TITLE);
        assertThat(skill.notes("o")).singleElement().satisfies(n -> {
            assertThat(n.content()).isEqualTo("buy milk");
            assertThat(n.tags()).containsExactly("home", "shopping");
        });
    }

    @Test
    void reminderKeepsSpokenTime() {
        ReminderSkill skill = new ReminderSkill(schema);

        ActionResult r = skill.execute("o", Map.of("reminder_text", "call the bank", "datetime", "tomorrow at 9"));

        assertThat(r.success()).isTrue();
        assertThat(r.data()).containsEntry("when", "tomorrow at 9").doesNotContainKey("recurrence");
        assertThat(skill.reminders("o")).hasSize(1);
    }

    @Test
    void reminderWithoutTimeIsRejected() {
        ActionResult r = new ReminderSkill(schema).execute("o", Map.of("reminder_text", "call the bank"));

        assertThat(r.success()).isFalse();
        assertThat(r.message()).isEqualTo("missing required information: datetime");
    }

    @Test
    void notesKeepOnlyTheMostRecentPerOwner() {
        NoteSkill skill = new NoteSkill(schema, 2);

        skill.execute("o", Map.of("note_content", "first"));
        skill.execute("o", Map.of("note_content", "second"));
        skill.execute("o", Map.of("note_content", "third"));
        skill.execute("other", Map.of("note_content", "theirs"));

        assertThat(skill.notes("o")).extracting(NoteSkill.Note::content).containsExactly("second", "third");
        assertThat(skill.notes("other")).extracting(NoteSkill.Note::content).containsExactly("theirs");
    }

    @Test
    void remindersKeepOnlyTheMostRecentPerOwner() {
        ReminderSkill skill = new ReminderSkill(schema, 1);

        skill.execute("o", Map.of("reminder_text", "call the bank", "datetime", "at 9"));
        skill.execute("o", Map.of("reminder_text", "water plants", "datetime", "at 6"));

        assertThat(skill.reminders("o")).extracting(ReminderSkill.Reminder::text).containsExactly("water plants");
    }

    @Test
    void searchBuildsEncodedUrl() {
        ActionResult r = new SearchWebSkill(schema).execute("o", Map.of("query", "java records & sealed"));

        assertThat(r.data()).containsEntry("url", "https://www.google.com/search?q=java+records+%26+sealed");
    }
}
