package com.phillippitts.speakagent.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the language model behind the classifier and phrase generator.
 *
 * <p>With {@code llm.enabled=false} (the default) the rule-based classifier and canned
 * phrasing are used and no API key is needed.
 */
@Validated
@ConfigurationProperties(prefix = "llm")
public class LlmProperties {

    private final boolean enabled;

    private final String apiKey;

    @NotBlank
    private final String modelName;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private final double temperature;

    @Min(1)
    private final int maxTokens;

    @Min(1)
    private final int timeoutSeconds;

    @ConstructorBinding
    public LlmProperties(Boolean enabled,
                         String apiKey,
                         String modelName,
                         Double temperature,
                         Integer maxTokens,
                         Integer timeoutSeconds) {
        this.enabled = enabled != null && enabled;
        this.apiKey = apiKey == null ? "" : apiKey;
        this.modelName = modelName == null || modelName.isBlank() ? "gpt-4o-mini" : modelName;
        this.temperature = temperature == null ? 0.3 : temperature;
        this.maxTokens = maxTokens == null ? 500 : maxTokens;
        this.timeoutSeconds = timeoutSeconds == null ? 20 : timeoutSeconds;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getModelName() {
        return modelName;
    }

    public double getTemperature() {
        return temperature;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
