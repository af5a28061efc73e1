/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend a common base so the REST boundary can map
 * them in one place. Inside a dialogue turn none of them escape the engine: every failure
 * of an external collaborator is converted to a task status and a spoken reply.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.speakagent.exception.SpeakAgentException} - Base exception</li>
 *   <li>{@link com.phillippitts.speakagent.exception.ExternalCallException} - A collaborator
 *       call timed out, was interrupted, or is unavailable; carries the call name</li>
 *   <li>{@link com.phillippitts.speakagent.exception.ClassificationException} - The intent
 *       classifier failed</li>
 *   <li>{@link com.phillippitts.speakagent.exception.IntentParseException} - The classifier
 *       answered with something that is not an intent guess</li>
 *   <li>{@link com.phillippitts.speakagent.exception.SessionNotFoundException} - Unknown or
 *       ended session (HTTP 404)</li>
 *   <li>{@link com.phillippitts.speakagent.exception.SessionBusyException} - A turn for the
 *       same session is still running (HTTP 409)</li>
 * </ul>
 *
 * @see com.phillippitts.speakagent.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.speakagent.exception;
