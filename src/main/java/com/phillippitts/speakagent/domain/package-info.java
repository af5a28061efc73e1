/**
 * Domain model of a dialogue: sessions, turns, intent guesses and the task-status machine.
 *
 * <p>Value types are records that validate themselves in their compact constructors.
 * {@link com.phillippitts.speakagent.domain.DialogueSession} is the one mutable type; it is
 * owned by a single turn at a time and changes status only through
 * {@link com.phillippitts.speakagent.domain.TaskStatusTransitions}.
 *
 * <p>Key domain concepts:
 * <ul>
 *   <li>{@link com.phillippitts.speakagent.domain.IntentGuess} - classifier output, replaced
 *       on every utterance</li>
 *   <li>{@link com.phillippitts.speakagent.domain.TaskStatus} - nine-state task progress,
 *       four of which end a turn</li>
 *   <li>{@link com.phillippitts.speakagent.domain.DisambiguationOption} - a slot the user
 *       must help resolve</li>
 *   <li>{@link com.phillippitts.speakagent.domain.ActionResult} - outcome of a skill</li>
 * </ul>
 */
package com.phillippitts.speakagent.domain;
