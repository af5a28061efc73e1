package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.service.dispatch.AbstractSkill;
import com.phillippitts.speakagent.service.slots.SlotSchema;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;

/**
 * Validates a spoken address ("github.com", "https://example.org/docs") and hands back the
 * absolute URL for the client to open.
 */
public class OpenUrlSkill extends AbstractSkill {

    public OpenUrlSkill(SlotSchema schema) {
        super(Intents.OPEN_URL, schema);
    }

    @Override
    protected ActionResult doExecute(String ownerId, Map<String, String> slots) {
        String spoken = slots.get("url").trim().replace(" dot ", ".").replace(" punto ", ".");
        String candidate = spoken.matches("(?i)^[a-z][a-z0-9+.-]*://.*") ? spoken : "https://" + spoken;
        URI uri;
        try {
            uri = new URI(candidate);
        } catch (URISyntaxException e) {
            return ActionResult.failure("that does not look like a web address: " + spoken);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            return ActionResult.failure("only web addresses can be opened: " + spoken);
        }
        if (uri.getHost() == null || !uri.getHost().contains(".")) {
            return ActionResult.failure("that does not look like a web address: " + spoken);
        }
        return ActionResult.success(null, Map.of("url", uri.toString()));
    }
}
