/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters;
 * the dialogue logic lives in {@code service.dialogue}.
 *
 * @see com.phillippitts.speakagent.presentation.controller
 * @see com.phillippitts.speakagent.presentation.exception
 */
package com.phillippitts.speakagent.presentation;
