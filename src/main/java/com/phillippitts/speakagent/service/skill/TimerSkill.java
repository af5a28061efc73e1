package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.service.dispatch.AbstractSkill;
import com.phillippitts.speakagent.service.slots.SlotSchema;
import com.phillippitts.speakagent.util.TextFolding;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Starts a countdown from a spoken duration such as "5 minutes", "an hour" or "30 segundos".
 */
public class TimerSkill extends AbstractSkill {

    private static final Pattern AMOUNT_UNIT = Pattern.compile(
            "\\b(\\d+(?:[.,]\\d+)?|an?|one|un|una|media)\\s*"
            + "(seconds?|secs?|s|minutes?|mins?|m|hours?|hrs?|h|segundos?|minutos?|horas?)\\b");

    private final Clock clock;

    public TimerSkill(SlotSchema schema) {
        this(schema, Clock.systemUTC());
    }

    TimerSkill(SlotSchema schema, Clock clock) {
        super(Intents.SET_TIMER, schema);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    protected ActionResult doExecute(String ownerId, Map<String, String> slots) {
        String spoken = slots.get("duration");
        Optional<Duration> parsed = parseDuration(spoken);
        if (parsed.isEmpty() || parsed.get().isZero()) {
            return ActionResult.failure("could not understand the duration '" + spoken.trim() + "'");
        }
        Duration d = parsed.get();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seconds", d.getSeconds());
        data.put("ends_at", Instant.now(clock).plus(d).toString());
        return ActionResult.success(null, data);
    }

    /**
     * Sums every amount/unit pair in the text; empty when none is found.
     */
    static Optional<Duration> parseDuration(String spoken) {
        String text = TextFolding.fold(spoken);
        Matcher m = AMOUNT_UNIT.matcher(text);
        Duration total = Duration.ZERO;
        boolean found = false;
        while (m.find()) {
            double amount = amount(m.group(1));
            long seconds = Math.round(amount * unitSeconds(m.group(2)));
            total = total.plusSeconds(seconds);
            found = true;
        }
        return found ? Optional.of(total) : Optional.empty();
    }

    private static double amount(String token) {
        return switch (token) {
            case "a", "an", "one", "un", "una" -> 1;
            case "media" -> 0.5;
            default -> Double.parseDouble(token.replace(',', '.'));
        };
    }

    private static long unitSeconds(String unit) {
        if (unit.startsWith("h")) {
            return 3600;
        }
        if (unit.startsWith("m")) {
            return 60;
        }
        return 1;
    }
}
