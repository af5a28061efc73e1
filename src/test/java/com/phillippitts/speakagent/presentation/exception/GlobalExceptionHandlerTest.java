package com.phillippitts.speakagent.presentation.exception;

import com.phillippitts.speakagent.exception.SessionBusyException;
import com.phillippitts.speakagent.exception.SessionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownSessionReturns404() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleSessionNotFound(new SessionNotFoundException("s-9"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("SessionNotFoundException");
        assertThat(response.getBody().details()).contains("s-9");
    }

    @Test
    void busySessionReturns409WithRetryHint() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleSessionBusy(new SessionBusyException("s-1", 2000));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("Session is busy").contains("retry");
    }

    @Test
    void illegalArgumentReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleIllegalArgument(new IllegalArgumentException("ownerId must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).isEqualTo("ownerId must not be blank");
    }

    @Test
    void unexpectedErrorReturns500WithoutInternals() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("secret stack detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret stack detail");
    }

    @Test
    void bodyCarriesTimestamp() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleSessionNotFound(new SessionNotFoundException("s"));

        assertThat(response.getBody().toString()).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
