package com.phillippitts.speakagent.config.llm;

import com.phillippitts.speakagent.config.properties.LlmProperties;
import com.phillippitts.speakagent.service.classify.IntentClassifier;
import com.phillippitts.speakagent.service.classify.IntentGuessParser;
import com.phillippitts.speakagent.service.classify.LanguageModelIntentClassifier;
import com.phillippitts.speakagent.service.phrase.LanguageModelPhraseGenerator;
import com.phillippitts.speakagent.service.phrase.PhraseGenerator;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Language-model backed classifier and phrase generator. Active when llm.enabled=true.
 */
@Configuration
@ConditionalOnProperty(prefix = "llm", name = "enabled", havingValue = "true")
public class LanguageModelConfig {
    private static final Logger LOG = LogManager.getLogger(LanguageModelConfig.class);

    @Bean
    public ChatLanguageModel chatLanguageModel(LlmProperties properties) {
        if (properties.getApiKey().isBlank()) {
            throw new IllegalStateException("llm.enabled=true requires llm.api-key (or OPENAI_API_KEY)");
        }
        LOG.info("Using language model {} (temperature={}, maxTokens={}, timeout={}s)",
                properties.getModelName(), properties.getTemperature(), properties.getMaxTokens(),
                properties.getTimeoutSeconds());
        return OpenAiChatModel.builder()
                .apiKey(properties.getApiKey())
                .modelName(properties.getModelName())
                .temperature(properties.getTemperature())
                .maxTokens(properties.getMaxTokens())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .build();
    }

    @Bean
    public IntentClassifier languageModelIntentClassifier(ChatLanguageModel model) {
        return new LanguageModelIntentClassifier(model, new IntentGuessParser());
    }

    @Bean
    public PhraseGenerator languageModelPhraseGenerator(ChatLanguageModel model) {
        return new LanguageModelPhraseGenerator(model);
    }
}
