package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.service.dispatch.AbstractSkill;
import com.phillippitts.speakagent.service.slots.SlotSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Queues a message for delivery on WhatsApp, Telegram or SMS.
 *
 * <p>Delivery itself belongs to a messaging gateway; this skill validates the request and
 * records it in an outbox that keeps the most recent messages of each owner.
 */
public class SendMessageSkill extends AbstractSkill {
    private static final Logger LOG = LogManager.getLogger(SendMessageSkill.class);

    static final String DEFAULT_PLATFORM = "whatsapp";
    private static final Set<String> PLATFORMS = Set.of("whatsapp", "telegram", "sms");

    private final RecentEntries<OutgoingMessage> outbox;

    public SendMessageSkill(SlotSchema schema) {
        this(schema, RecentEntries.DEFAULT_MAX_PER_OWNER);
    }

    public SendMessageSkill(SlotSchema schema, int maxPerOwner) {
        super(Intents.SEND_MESSAGE, schema);
        this.outbox = new RecentEntries<>(maxPerOwner);
    }

    @Override
    protected ActionResult doExecute(String ownerId, Map<String, String> slots) {
        String platform = slot(slots, "platform", DEFAULT_PLATFORM).toLowerCase(Locale.ROOT);
        if (!PLATFORMS.contains(platform)) {
            return ActionResult.failure("unsupported platform: " + platform);
        }
        String recipient = slots.get("recipient").trim();
        String recipientId = slots.get("recipient_id");
        OutgoingMessage msg = new OutgoingMessage(ownerId, recipient, recipientId, platform,
                slots.get("message_content").trim(), Instant.now());
        outbox.add(ownerId, msg);
        LOG.info("Queued {} message for recipient id={}", platform, recipientId == null ? "unresolved" : recipientId);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("recipient", recipient);
        if (recipientId != null) {
            data.put("recipient_id", recipientId);
        }
        data.put("platform", platform);
        data.put("status", "queued");
        return ActionResult.success(null, data);
    }

    /** Most recent messages queued for an owner, oldest first. */
    public List<OutgoingMessage> outbox(String ownerId) {
        return outbox.of(ownerId);
    }

    public record OutgoingMessage(String ownerId, String recipient, String recipientId, String platform,
                                  String content, Instant queuedAt) { }
}
