package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.service.dispatch.AbstractSkill;
import com.phillippitts.speakagent.service.slots.SlotSchema;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Saves a note with an optional title and comma-separated tags.
 */
public class NoteSkill extends AbstractSkill {

    static final String DEFAULT_TITLE = "Quick note";

    private final RecentEntries<Note> notes;

    public NoteSkill(SlotSchema schema) {
        this(schema, RecentEntries.DEFAULT_MAX_PER_OWNER);
    }

    public NoteSkill(SlotSchema schema, int maxPerOwner) {
        super(Intents.CREATE_NOTE, schema);
        this.notes = new RecentEntries<>(maxPerOwner);
    }

    @Override
    protected ActionResult doExecute(String ownerId, Map<String, String> slots) {
        String tagsRaw = slot(slots, "tags", "");
        List<String> tags = tagsRaw.isEmpty()
                ? List.of()
                : Arrays.stream(tagsRaw.split(",")).map(String::trim).filter(t -> !t.isEmpty()).toList();
        Note note = new Note(UUID.randomUUID().toString(), ownerId, slot(slots, "title", DEFAULT_TITLE),
                slots.get("note_content").trim(), tags, Instant.now());
        notes.add(ownerId, note);
        return ActionResult.success(null, Map.of("note_id", note.id(), "title", note.title()));
    }

    public List<Note> notes(String ownerId) {
        return notes.of(ownerId);
    }

    public record Note(String id, String ownerId, String title, String content, List<String> tags,
                       Instant createdAt) { }
}
