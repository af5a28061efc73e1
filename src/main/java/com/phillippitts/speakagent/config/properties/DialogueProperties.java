package com.phillippitts.speakagent.config.properties;

import com.phillippitts.speakagent.domain.Intents;
import com.phillippitts.speakagent.domain.Language;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the dialogue engine.
 */
@Validated
@ConfigurationProperties(prefix = "dialogue")
public class DialogueProperties {

    /**
     * Clarifying questions allowed per task before the assistant gives up and asks the user
     * to start over.
     */
    @Min(0)
    private final int maxClarifications;

    /** Most recent turns handed to the classifier and phrase generator. */
    @Min(1)
    private final int historyWindow;

    @NotNull
    private final Language primaryLanguage;

    /**
     * Upper bound for each classifier, contact, skill or phrasing call. 0 disables the bound.
     */
    @Min(0)
    private final long externalCallTimeoutMs;

    @Min(0)
    private final long sessionLockTimeoutMs;

    /** Intents dispatched directly, without slot negotiation. */
    @NotNull
    private final List<String> systemActionIntents;

    @ConstructorBinding
    public DialogueProperties(Integer maxClarifications,
                              Integer historyWindow,
                              Language primaryLanguage,
                              Long externalCallTimeoutMs,
                              Long sessionLockTimeoutMs,
                              List<String> systemActionIntents) {
        this.maxClarifications = maxClarifications == null ? 3 : maxClarifications;
        this.historyWindow = historyWindow == null ? 10 : historyWindow;
        this.primaryLanguage = primaryLanguage == null ? Language.EN : primaryLanguage;
        this.externalCallTimeoutMs = externalCallTimeoutMs == null ? 10_000L : externalCallTimeoutMs;
        this.sessionLockTimeoutMs = sessionLockTimeoutMs == null ? 2_000L : sessionLockTimeoutMs;
        this.systemActionIntents = systemActionIntents == null
                ? List.of(Intents.OPEN_APP)
                : List.copyOf(systemActionIntents);
    }

    /**
     * Defaults for tests.
     */
    public DialogueProperties() {
        this(null, null, null, null, null, null);
    }

    public int getMaxClarifications() {
        return maxClarifications;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public Language getPrimaryLanguage() {
        return primaryLanguage;
    }

    public long getExternalCallTimeoutMs() {
        return externalCallTimeoutMs;
    }

    public long getSessionLockTimeoutMs() {
        return sessionLockTimeoutMs;
    }

    public List<String> getSystemActionIntents() {
        return systemActionIntents;
    }
}
