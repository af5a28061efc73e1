package com.phillippitts.speakagent.service.classify;

import com.phillippitts.speakagent.domain.IntentGuess;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.exception.IntentParseException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the JSON reply of a classification model into an {@link IntentGuess}.
 *
 * <p>Expected shape: {@code {"intent": "...", "confidence": 0.9, "entities": {...},
 * "missing": [...], "reasoning": "..."}}. Models often wrap JSON in a markdown code fence
 * or add prose around it, so the first JSON object in the reply is used.
 *
 * <p>Lenient on content: unknown intent names become {@code unknown}, confidence is clamped
 * to [0,1], null slot values are dropped and non-string values are stringified. Strict on
 * shape: a reply without a JSON object or without an intent raises
 * {@link IntentParseException}.
 */
public class IntentGuessParser {

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");
    private static final double DEFAULT_CONFIDENCE = 0.5;

    public IntentGuess parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new IntentParseException("Empty classifier reply", reply);
        }
        JSONObject root;
        try {
            root = new JSONObject(extractJson(reply));
        } catch (JSONException e) {
            throw new IntentParseException("Classifier reply is not a valid JSON object", reply, e);
        }
        Object intentValue = root.opt("intent");
        if (!(intentValue instanceof String) || ((String) intentValue).isBlank()) {
            throw new IntentParseException("Classifier reply has no intent", reply);
        }
        String intent = ((String) intentValue).trim().toLowerCase(Locale.ROOT);
        if (!Intents.isKnown(intent)) {
            intent = Intents.UNKNOWN;
        }
        return new IntentGuess(
                intent,
                confidence(root.opt("confidence")),
                slots(root.optJSONObject("entities")),
                missing(root.optJSONArray("missing")),
                root.optString("reasoning", "")
        );
    }

    static String extractJson(String reply) {
        Matcher fence = CODE_FENCE.matcher(reply);
        String body = fence.find() ? fence.group(1) : reply;
        int start = body.indexOf('{');
        int end = body.lastIndexOf('}');
        if (start < 0 || end < start) {
            return body.trim();
        }
        return body.substring(start, end + 1);
    }

    private static double confidence(Object value) {
        if (!(value instanceof Number)) {
            return DEFAULT_CONFIDENCE;
        }
        double c = ((Number) value).doubleValue();
        if (Double.isNaN(c)) {
            return DEFAULT_CONFIDENCE;
        }
        return Math.max(0.0, Math.min(1.0, c));
    }

    private static Map<String, String> slots(JSONObject entities) {
        Map<String, String> slots = new LinkedHashMap<>();
        if (entities == null) {
            return slots;
        }
        for (String key : entities.keySet()) {
            Object v = entities.opt(key);
            if (v == null || JSONObject.NULL.equals(v)) {
                continue;
            }
            slots.put(key, v.toString());
        }
        return slots;
    }

    private static List<String> missing(JSONArray array) {
        List<String> names = new ArrayList<>();
        if (array == null) {
            return names;
        }
        for (int i = 0; i < array.length(); i++) {
            Object n = array.opt(i);
            if (n instanceof String && !((String) n).isBlank()) {
                names.add((String) n);
            }
        }
        return names;
    }
}
