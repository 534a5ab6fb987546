package com.llmcouncil.service.model;

import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelQueryError;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;

class ModelErrorClassifierTest {

    @Test
    void mapsHttpStatusToKind() {
        assertThat(classify(HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "Unauthorized", null, null, null)))
                .extracting(ModelQueryError::kind, ModelQueryError::message, ModelQueryError::statusCode)
                .containsExactly(ErrorKind.AUTH, "Invalid API key", 401);
        assertThat(classify(HttpClientErrorException.create(HttpStatus.PAYMENT_REQUIRED, "", null, null, null)).kind())
                .isEqualTo(ErrorKind.PAYMENT);
        assertThat(classify(HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "", null, null, null)).kind())
                .isEqualTo(ErrorKind.RATE_LIMIT);
        assertThat(classify(HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "", null, null, null)).message())
                .isEqualTo("Server error (HTTP 502)");
    }

    @Test
    void unmappedStatusKeepsStatusText() {
        ModelQueryError error = classify(
                HttpClientErrorException.create(HttpStatus.BAD_REQUEST, "Bad Request", null, null, null));

        assertThat(error.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(error.message()).isEqualTo("HTTP 400: Bad Request");
    }

    @Test
    void nestedSocketTimeoutIsTimeout() {
        ResourceAccessException ex = new ResourceAccessException("I/O error",
                new SocketTimeoutException("Read timed out"));

        assertThat(classify(new CompletionException(ex)).kind()).isEqualTo(ErrorKind.TIMEOUT);
    }

    @Test
    void otherFailuresKeepMessage() {
        ModelQueryError error = classify(new IllegalStateException("connection reset"));

        assertThat(error.kind()).isEqualTo(ErrorKind.UNKNOWN);
        assertThat(error.message()).isEqualTo("connection reset");
        assertThat(error.model()).isEqualTo("m/one");
    }

    @Test
    void explicitTimeoutNamesDeadline() {
        assertThat(ModelErrorClassifier.timeout("m/one", 1500).message()).contains("1500 ms");
    }

    private static ModelQueryError classify(Throwable t) {
        return ModelErrorClassifier.classify("m/one", t);
    }
}
