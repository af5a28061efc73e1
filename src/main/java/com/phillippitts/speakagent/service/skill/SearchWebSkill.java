package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.service.dispatch.AbstractSkill;
import com.phillippitts.speakagent.service.slots.SlotSchema;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Builds a web search link for the spoken query; the client opens it.
 */
public class SearchWebSkill extends AbstractSkill {

    static final String SEARCH_URL = "https://www.google.com/search?q=";

    public SearchWebSkill(SlotSchema schema) {
        super(Intents.SEARCH_WEB, schema);
    }

    @Override
    protected ActionResult doExecute(String ownerId, Map<String, String> slots) {
        String query = slots.get("query").trim();
        String url = SEARCH_URL + URLEncoder.encode(query, StandardCharsets.UTF_8);
        return ActionResult.success(null, Map.of("query", query, "url", url));
    }
}
