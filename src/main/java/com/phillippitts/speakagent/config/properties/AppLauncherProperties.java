package com.phillippitts.speakagent.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Launch commands for the {@code open_app} system action ({@code assistant.apps.*}).
 *
 * <p>Keys are canonical app names ("chrome", "spotify"); values are the command line that
 * starts the app on the host. Launching is off by default so a server deployment never
 * spawns desktop processes.
 */
@ConfigurationProperties(prefix = "assistant.apps")
public class AppLauncherProperties {

    private boolean launchEnabled = false;
    private Map<String, String> commands = new LinkedHashMap<>();

    public boolean isLaunchEnabled() {
        return launchEnabled;
    }

    public void setLaunchEnabled(boolean launchEnabled) {
        this.launchEnabled = launchEnabled;
    }

    public Map<String, String> getCommands() {
        return commands;
    }

    public void setCommands(Map<String, String> commands) {
        this.commands = commands;
    }
}
