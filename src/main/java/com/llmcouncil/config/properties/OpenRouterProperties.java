package com.llmcouncil.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Chat-completion transport settings.
 *
 * <p>{@code requestTimeout} is the per-call ceiling for every deliberation call.
 * {@code auxiliaryTimeout} bounds the cheaper side calls (history summary, title).
 */
@Validated
@ConfigurationProperties(prefix = "council.openrouter")
public class OpenRouterProperties {

    public static final String DEFAULT_API_URL = "https://openrouter.ai/api/v1/chat/completions";

    @NotBlank
    private final String apiUrl;

    /** May be empty; the health indicator then reports DOWN and every call fails with auth. */
    private final String apiKey;

    private final Duration requestTimeout;
    private final Duration auxiliaryTimeout;
    private final Duration connectTimeout;

    @ConstructorBinding
    public OpenRouterProperties(String apiUrl, String apiKey, Duration requestTimeout,
                                Duration auxiliaryTimeout, Duration connectTimeout) {
        this.apiUrl = apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.requestTimeout = positiveOr(requestTimeout, Duration.ofSeconds(120), "request-timeout");
        this.auxiliaryTimeout = positiveOr(auxiliaryTimeout, Duration.ofSeconds(30), "auxiliary-timeout");
        this.connectTimeout = positiveOr(connectTimeout, Duration.ofSeconds(10), "connect-timeout");
    }

    private static Duration positiveOr(Duration value, Duration fallback, String name) {
        Duration d = value == null ? fallback : value;
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException("council.openrouter." + name + " must be > 0");
        }
        return d;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return !apiKey.isEmpty();
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getAuxiliaryTimeout() {
        return auxiliaryTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }
}
