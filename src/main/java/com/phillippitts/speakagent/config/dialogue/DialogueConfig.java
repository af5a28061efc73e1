package com.phillippitts.speakagent.config.dialogue;

import com.phillippitts.speakagent.config.properties.AppLauncherProperties;
import com.phillippitts.speakagent.config.properties.ContactProperties;
import com.phillippitts.speakagent.config.properties.DialogueProperties;
import com.phillippitts.speakagent.service.clarify.Clarifier;
import com.phillippitts.speakagent.service.classify.IntentClassifier;
import com.phillippitts.speakagent.service.classify.RuleBasedIntentClassifier;
import com.phillippitts.speakagent.service.compose.ResponseComposer;
import com.phillippitts.speakagent.service.dialogue.DefaultDialogueEngine;
import com.phillippitts.speakagent.service.dialogue.DialogueEngine;
import com.phillippitts.speakagent.service.dialogue.InputNormalizer;
import com.phillippitts.speakagent.service.dialogue.IntentDetector;
import com.phillippitts.speakagent.service.dialogue.IntentRouter;
import com.phillippitts.speakagent.service.dispatch.ActionDispatcher;
import com.phillippitts.speakagent.service.dispatch.Skill;
import com.phillippitts.speakagent.service.dispatch.SkillRegistry;
import com.phillippitts.speakagent.service.external.ExternalCallGuard;
import com.phillippitts.speakagent.service.metrics.DialogueMetricsPublisher;
import com.phillippitts.speakagent.service.phrase.OfflinePhraseGenerator;
import com.phillippitts.speakagent.service.phrase.PhraseGenerator;
import com.phillippitts.speakagent.service.resolve.ContactDirectory;
import com.phillippitts.speakagent.service.resolve.EntityResolver;
import com.phillippitts.speakagent.service.resolve.InMemoryContactDirectory;
import com.phillippitts.speakagent.service.session.ConversationService;
import com.phillippitts.speakagent.service.session.DialogueSessionStore;
import com.phillippitts.speakagent.service.session.InMemoryDialogueSessionStore;
import com.phillippitts.speakagent.service.skill.AppLauncher;
import com.phillippitts.speakagent.service.skill.NoteSkill;
import com.phillippitts.speakagent.service.skill.OpenAppSkill;
import com.phillippitts.speakagent.service.skill.OpenUrlSkill;
import com.phillippitts.speakagent.service.skill.ProcessAppLauncher;
import com.phillippitts.speakagent.service.skill.ReminderSkill;
import com.phillippitts.speakagent.service.skill.SearchWebSkill;
import com.phillippitts.speakagent.service.skill.SendMessageSkill;
import com.phillippitts.speakagent.service.skill.TimerSkill;
import com.phillippitts.speakagent.service.slots.SlotChecker;
import com.phillippitts.speakagent.service.slots.SlotSchema;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Wires the dialogue engine and its collaborators explicitly.
 *
 * <p>The skill registry is built once here from every {@link Skill} bean and handed to the
 * dispatcher; nothing looks skills up by name elsewhere. Without a language model
 * ({@code llm.enabled=false}) the rule-based classifier and the offline phrase generator are used.
 */
@Configuration
public class DialogueConfig {

    private final DialogueProperties dialogueProperties;
    private final ApplicationEventPublisher publisher;
    private final DialogueMetricsPublisher metricsPublisher;

    public DialogueConfig(DialogueProperties dialogueProperties,
                          ApplicationEventPublisher publisher,
                          DialogueMetricsPublisher metricsPublisher) {
        this.dialogueProperties = dialogueProperties;
        this.publisher = publisher;
        this.metricsPublisher = metricsPublisher;
    }

    @Bean
    public SlotSchema slotSchema() {
        return SlotSchema.standard();
    }

    @Bean
    public ExternalCallGuard externalCallGuard(@Qualifier("dialogueExecutor") Executor dialogueExecutor) {
        return new ExternalCallGuard(dialogueExecutor, dialogueProperties.getExternalCallTimeoutMs());
    }

    /**
     * Offline classifier. Active when llm.enabled is false or missing.
     */
    @Bean
    @ConditionalOnProperty(prefix = "llm", name = "enabled", havingValue = "false", matchIfMissing = true)
    public IntentClassifier ruleBasedIntentClassifier() {
        return new RuleBasedIntentClassifier();
    }

    /**
     * Offline phrase generator. Active when llm.enabled is false or missing.
     */
    @Bean
    @ConditionalOnProperty(prefix = "llm", name = "enabled", havingValue = "false", matchIfMissing = true)
    public PhraseGenerator offlinePhraseGenerator() {
        return new OfflinePhraseGenerator();
    }

    @Bean
    @ConditionalOnMissingBean(ContactDirectory.class)
    public ContactDirectory contactDirectory(ContactProperties contactProperties) {
        return new InMemoryContactDirectory(contactProperties);
    }

    @Bean
    @ConditionalOnMissingBean(AppLauncher.class)
    public AppLauncher appLauncher() {
        return new ProcessAppLauncher();
    }

    // Skills

    @Bean
    public SendMessageSkill sendMessageSkill(SlotSchema schema) {
        return new SendMessageSkill(schema);
    }

    @Bean
    public ReminderSkill reminderSkill(SlotSchema schema) {
        return new ReminderSkill(schema);
    }

    @Bean
    public NoteSkill noteSkill(SlotSchema schema) {
        return new NoteSkill(schema);
    }

    @Bean
    public TimerSkill timerSkill(SlotSchema schema) {
        return new TimerSkill(schema);
    }

    @Bean
    public SearchWebSkill searchWebSkill(SlotSchema schema) {
        return new SearchWebSkill(schema);
    }

    @Bean
    public OpenUrlSkill openUrlSkill(SlotSchema schema) {
        return new OpenUrlSkill(schema);
    }

    @Bean
    public OpenAppSkill openAppSkill(SlotSchema schema, AppLauncherProperties appProperties, AppLauncher launcher) {
        return new OpenAppSkill(schema, appProperties, launcher);
    }

    @Bean
    public SkillRegistry skillRegistry(List<Skill> skills) {
        return new SkillRegistry(skills);
    }

    // Engine steps

    @Bean
    public DialogueEngine dialogueEngine(IntentClassifier classifier,
                                         PhraseGenerator phraseGenerator,
                                         ContactDirectory contactDirectory,
                                         SkillRegistry skillRegistry,
                                         SlotSchema schema,
                                         ExternalCallGuard guard) {
        Set<String> systemActions = new LinkedHashSet<>(dialogueProperties.getSystemActionIntents());
        int window = dialogueProperties.getHistoryWindow();
        return new DefaultDialogueEngine(
                new InputNormalizer(dialogueProperties.getPrimaryLanguage()),
                new IntentDetector(classifier, guard, window, publisher, metricsPublisher),
                new IntentRouter(systemActions),
                new SlotChecker(schema),
                new EntityResolver(contactDirectory, guard),
                new Clarifier(phraseGenerator, guard, metricsPublisher),
                new ActionDispatcher(skillRegistry, guard, systemActions, publisher, metricsPublisher),
                new ResponseComposer(phraseGenerator, guard, window),
                metricsPublisher);
    }

    @Bean
    public DialogueSessionStore dialogueSessionStore() {
        return new InMemoryDialogueSessionStore();
    }

    @Bean
    public ConversationService conversationService(DialogueEngine engine, DialogueSessionStore store) {
        return new ConversationService(engine, store, publisher,
                dialogueProperties.getMaxClarifications(), dialogueProperties.getSessionLockTimeoutMs());
    }
}
