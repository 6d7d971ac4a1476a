package com.phillippitts.captionhub.presentation.exception;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.SessionState;
import com.phillippitts.captionhub.exception.ChannelNotFoundException;
import com.phillippitts.captionhub.exception.InvalidStateTransitionException;
import com.phillippitts.captionhub.exception.SessionNotFoundException;
import com.phillippitts.captionhub.exception.SessionStartException;
import com.phillippitts.captionhub.exception.UnsupportedLanguageException;
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
    void invalidTransitionMapsToConflict() {
        InvalidStateTransitionException ex =
                new InvalidStateTransitionException("s1", SessionState.ENDED, SessionState.ACTIVE);

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleInvalidTransition(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidStateTransitionException");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void unknownSessionOrChannelMapsToNotFound() {
        assertThat(handler.handleNotFound(new SessionNotFoundException("s1")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleNotFound(new ChannelNotFoundException(new ChannelKey("s1", "fr"))).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void unsupportedLanguageMapsToBadRequest() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleInvalidInput(new UnsupportedLanguageException("xx"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).contains("xx");
    }

    @Test
    void startFailureMapsToServiceUnavailableWithoutLeakingCause() {
        SessionStartException ex = new SessionStartException("s1", new IllegalStateException("db password=secret"));

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleStartFailure(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).doesNotContain("secret");
    }

    @Test
    void unexpectedErrorMapsToInternalServerError() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new RuntimeException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().message()).doesNotContain("boom");
    }
}
