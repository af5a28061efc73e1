package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.service.dispatch.AbstractSkill;
import com.phillippitts.speakagent.service.slots.SlotSchema;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records a reminder. The spoken time expression is stored as given; scheduling belongs to
 * the notification service.
 */
public class ReminderSkill extends AbstractSkill {

    private final RecentEntries<Reminder> reminders;

    public ReminderSkill(SlotSchema schema) {
        this(schema, RecentEntries.DEFAULT_MAX_PER_OWNER);
    }

    public ReminderSkill(SlotSchema schema, int maxPerOwner) {
        super(Intents.SET_REMINDER, schema);
        this.reminders = new RecentEntries<>(maxPerOwner);
    }

    @Override
    protected ActionResult doExecute(String ownerId, Map<String, String> slots) {
        Reminder r = new Reminder(UUID.randomUUID().toString(), ownerId, slots.get("reminder_text").trim(),
                slots.get("datetime").trim(), slot(slots, "recurrence", null), Instant.now());
        reminders.add(ownerId, r);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reminder_id", r.id());
        data.put("when", r.when());
        if (r.recurrence() != null) {
            data.put("recurrence", r.recurrence());
        }
        return ActionResult.success(null, data);
    }

    public List<Reminder> reminders(String ownerId) {
        return reminders.of(ownerId);
    }

    public record Reminder(String id, String ownerId, String text, String when, String recurrence,
                           Instant createdAt) { }
}
