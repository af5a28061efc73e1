package com.phillippitts.speakagent.service.skill;

import com.phillippitts.speakagent.config.properties.AppLauncherProperties;
import com.phillippitts.speakagent.domain.ActionResult;
import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.service.dispatch.AbstractSkill;
import com.phillippitts.speakagent.service.slots.SlotSchema;
import com.phillippitts.speakagent.util.TextFolding;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * System action that opens a desktop application by its spoken name.
 *
 * <p>Spoken names ("calculadora", "google chrome", "bloc de notas") map to a canonical app
 * name; the launch command for that name comes from {@link AppLauncherProperties}. When
 * launching is disabled the skill only reports what it would open.
 */
public class OpenAppSkill extends AbstractSkill {
    private static final Logger LOG = LogManager.getLogger(OpenAppSkill.class);

    private static final Map<String, String> ALIASES = aliases();

    private final AppLauncherProperties properties;
    private final AppLauncher launcher;

    public OpenAppSkill(SlotSchema schema, AppLauncherProperties properties, AppLauncher launcher) {
        super(Intents.OPEN_APP, schema);
        this.properties = Objects.requireNonNull(properties, "properties");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
    }

    @Override
    protected ActionResult doExecute(String ownerId, Map<String, String> slots) {
        String spoken = slots.get("app_name").trim();
        Optional<String> app = canonicalName(spoken);
        if (app.isEmpty()) {
            return ActionResult.failure("I don't know the app '" + spoken + "'");
        }
        String name = app.get();
        String command = commandFor(name);
        if (command == null || command.isBlank()) {
            return ActionResult.failure("no launch command configured for " + name);
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("app", name);
        if (!properties.isLaunchEnabled()) {
            LOG.info("App launch disabled; would open {}", name);
            data.put("launched", false);
            return ActionResult.success(null, data);
        }
        try {
            launcher.launch(Arrays.stream(command.trim().split("\\s+")).toList());
        } catch (IOException e) {
            LOG.warn("Failed to launch {}: {}", name, e.getMessage());
            return ActionResult.failure("could not open " + name);
        }
        LOG.info("Launched {}", name);
        data.put("launched", true);
        return ActionResult.success(null, data);
    }

    /**
     * Canonical app name for a spoken name; configured command keys are accepted as-is.
     */
    Optional<String> canonicalName(String spoken) {
        String folded = String.join(" ", TextFolding.words(spoken));
        if (ALIASES.containsKey(folded)) {
            return Optional.of(ALIASES.get(folded));
        }
        for (String key : properties.getCommands().keySet()) {
            if (TextFolding.fold(key).equals(folded)) {
                return Optional.of(folded);
            }
        }
        return Optional.empty();
    }

    private String commandFor(String name) {
        for (Map.Entry<String, String> e : properties.getCommands().entrySet()) {
            if (TextFolding.fold(e.getKey()).equals(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static Map<String, String> aliases() {
        Map<String, String> m = new LinkedHashMap<>();
        put(m, "whatsapp", List.of("whatsapp", "whats app", "wasap"));
        put(m, "spotify", List.of("spotify", "musica", "music"));
        put(m, "chrome", List.of("chrome", "google chrome", "browser", "navegador", "the browser", "el navegador"));
        put(m, "calculator", List.of("calculator", "calculadora", "the calculator", "la calculadora"));
        put(m, "notepad", List.of("notepad", "notes", "notas", "bloc de notas", "text editor"));
        put(m, "vscode", List.of("vscode", "vs code", "visual studio code", "code"));
        put(m, "terminal", List.of("terminal", "the terminal", "la terminal", "consola"));
        return Map.copyOf(m);
    }

    private static void put(Map<String, String> m, String canonical, List<String> spoken) {
        spoken.forEach(s -> m.put(s, canonical));
    }
}
