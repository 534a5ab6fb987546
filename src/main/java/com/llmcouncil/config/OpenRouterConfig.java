package com.llmcouncil.config;

import com.llmcouncil.config.properties.OpenRouterProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the chat-completion endpoint.
 *
 * <p>The read timeout matches the per-call request timeout; the fan-out service enforces the
 * same deadline on its side, so whichever fires first classifies the call as a timeout.
 */
@Configuration
public class OpenRouterConfig {

    @Bean
    public RestTemplate openRouterRestTemplate(RestTemplateBuilder builder, OpenRouterProperties props) {
        return builder
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getRequestTimeout())
                .build();
    }
}
