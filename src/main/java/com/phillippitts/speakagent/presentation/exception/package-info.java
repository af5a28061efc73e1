/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.speakagent.exception.SessionNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.speakagent.exception.SessionBusyException} → 409 Conflict (retry)</li>
 *   <li>Request validation failures, unreadable bodies → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "SessionNotFoundException",
 *   "message": "Session not found",
 *   "details": "No active session with id 3f1c...",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>Dialogue failures never reach this package: the engine turns them into a spoken reply.
 */
package com.phillippitts.speakagent.presentation.exception;
