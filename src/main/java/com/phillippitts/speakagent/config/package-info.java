/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.speakagent.config.ThreadPoolConfig} - executor for bounded
 *       external calls, with MDC propagation</li>
 *   <li>{@link com.phillippitts.speakagent.config.dialogue.DialogueConfig} - explicit wiring of
 *       the dialogue engine, skills and session service</li>
 *   <li>{@link com.phillippitts.speakagent.config.llm.LanguageModelConfig} - OpenAI chat model
 *       and the classifier/phrase generator built on it ({@code llm.enabled=true})</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code @ConfigurationProperties}</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 */
package com.phillippitts.speakagent.config;
