package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.service.slots.SlotSchema;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SendMessageSkillTest {

    private final SendMessageSkill skill = new SendMessageSkill(SlotSchema.standard());

    @Test
    void queuesOnWhatsappByDefault() {
        ActionResult r = skill.execute("owner-1", Map.of(
                "recipient", "Maria Lopez", "recipient_id", "c-mom", "message_content", " running late "));

        assertThat(r.success()).isTrue();
        assertThat(r.message()).isNull();
        assertThat(r.data()).containsEntry("platform", "whatsapp").containsEntry("recipient_id", "c-mom");
        assertThat(skill.outbox("owner-1")).singleElement().satisfies(m -> {
            assertThat(m.content()).isEqualTo("running late");
            assertThat(m.recipient()).isEqualTo("Maria Lopez");
        });
        assertThat(skill.outbox("someone-else")).isEmpty();
    }

    @Test
    void acceptsKnownPlatformCaseInsensitively() {
        ActionResult r = skill.execute("o", Map.of("recipient", "Ana", "message_content", "hi", "platform", "Telegram"));

        assertThat(r.success()).isTrue();
        assertThat(r.data()).containsEntry("platform", "telegram");
    }

    @Test
    void rejectsUnknownPlatform() {
        ActionResult r = skill.execute("o", Map.of("recipient", "Ana", "message_content", "hi", "platform", "fax"));

        assertThat(r.success()).isFalse();
        assertThat(r.message()).isEqualTo("unsupported platform: fax");
    }

    @Test
    void missingRequiredSlotsAreReported() {
        ActionResult r = skill.execute("o", Map.of("recipient", " "));

        assertThat(r.success()).isFalse();
        assertThat(r.message()).isEqualTo("missing required information: recipient, message_content");
        assertThat(skill.outbox("o")).isEmpty();
    }
}
