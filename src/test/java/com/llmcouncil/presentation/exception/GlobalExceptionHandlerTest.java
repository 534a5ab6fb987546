package com.llmcouncil.presentation.exception;

import com.llmcouncil.exception.ConversationHistoryException;
import com.llmcouncil.exception.ConversationNotFoundException;
import com.llmcouncil.exception.ConversationStoreException;
import com.llmcouncil.exception.DeliberationCancelledException;
import com.llmcouncil.exception.InvalidMessageException;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BeanPropertyBindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void notFoundMapsTo404() {
        ResponseEntity<?> response = handler.handleNotFound(new ConversationNotFoundException("c-404"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString())
                .contains("ConversationNotFoundException")
                .contains("c-404");
    }

    @Test
    void invalidInputMapsTo400() {
        ResponseEntity<?> blank = handler.handleInvalidInput(new InvalidMessageException("Message content must not be empty"));
        ResponseEntity<?> mode = handler.handleInvalidInput(new IllegalArgumentException("Unknown mode: jury"));

        assertThat(blank.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(blank.getBody().toString()).contains("must not be empty");
        assertThat(mode.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(mode.getBody().toString()).contains("IllegalArgumentException");
    }

    @Test
    void bodyValidationMapsTo400WithFieldName() throws NoSuchMethodException {
        BeanPropertyBindingResult binding = new BeanPropertyBindingResult(new Object(), "sendMessageRequest");
        binding.addError(new FieldError("sendMessageRequest", "content", "must not be blank"));
        MethodParameter parameter = new MethodParameter(
                String.class.getMethod("valueOf", Object.class), 0);

        ResponseEntity<?> response = handler.handleValidation(new MethodArgumentNotValidException(parameter, binding));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString())
                .contains("ValidationError")
                .contains("content must not be blank");
    }

    @Test
    void unreadableHistoryMapsTo503() {
        ResponseEntity<?> response = handler.handleHistory(
                new ConversationHistoryException("Cannot read", "c1", new IOException("truncated")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("retry");
    }

    @Test
    void cancelledMapsTo503() {
        ResponseEntity<?> response = handler.handleCancelled(
                new DeliberationCancelledException("Deliberation interrupted", new InterruptedException()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void storageFailureHidesPath() {
        ResponseEntity<?> response = handler.handleStore(
                new ConversationStoreException("Failed to write /var/data/conversations/c1.json"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("/var/data");
    }

    @Test
    void unexpectedErrorIsGeneric() {
        ResponseEntity<?> response = handler.handleUnexpected(new NullPointerException("secret detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret detail");
    }
}
