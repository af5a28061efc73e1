/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints:
 * <ul>
 *   <li>{@code POST /api/sessions} - open a dialogue session for an owner</li>
 *   <li>{@code GET /api/sessions/{id}} - inspect session state</li>
 *   <li>{@code POST /api/sessions/{id}/turns} - submit one utterance and get the reply</li>
 *   <li>{@code DELETE /api/sessions/{id}} - end a session</li>
 * </ul>
 *
 * <p>Controllers only translate HTTP to service calls; exceptions are left to
 * {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.speakagent.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.speakagent.presentation.controller;
