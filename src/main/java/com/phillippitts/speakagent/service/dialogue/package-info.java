/**
 * The dialogue engine: one user utterance in, one reply out.
 *
 * <p>A turn is a loop over {@link com.phillippitts.speakagent.service.dialogue.DialogueStep}s.
 * Every step reports a {@link com.phillippitts.speakagent.domain.DialogueEvent}, which drives
 * both the task status ({@link com.phillippitts.speakagent.domain.TaskStatusTransitions}) and the
 * next step ({@link com.phillippitts.speakagent.service.dialogue.StepTransitions}).
 *
 * <p>Collaborators that may block (classifier, contact lookup, skills, phrase generation) are
 * called through {@link com.phillippitts.speakagent.service.external.ExternalCallGuard}.
 */
package com.phillippitts.speakagent.service.dialogue;
