package com.llmcouncil.service.model;

import com.llmcouncil.config.properties.OpenRouterProperties;
import com.llmcouncil.domain.ChatMessage;
import com.llmcouncil.domain.ErrorKind;
import com.llmcouncil.domain.ModelCallResult;
import com.llmcouncil.domain.ModelQueryError;
import com.llmcouncil.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Objects;

/**
 * {@link ModelCaller} backed by the OpenRouter chat-completion endpoint.
 *
 * <p>Request and response bodies are built and read with org.json. When web search is requested
 * the {@code :online} variant of the model id is sent, but the returned result keeps the
 * configured id so that label maps and error lists show what the operator configured.
 */
@Component
public class OpenRouterModelCaller implements ModelCaller {

    private static final Logger LOG = LogManager.getLogger(OpenRouterModelCaller.class);

    private final RestTemplate restTemplate;
    private final OpenRouterProperties props;

    public OpenRouterModelCaller(RestTemplate openRouterRestTemplate, OpenRouterProperties props) {
        this.restTemplate = Objects.requireNonNull(openRouterRestTemplate);
        this.props = Objects.requireNonNull(props);
    }

    @Override
    public ModelCallResult call(String model, List<ChatMessage> messages, boolean webSearch) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(messages, "messages");
        String wireModel = ModelIds.effectiveModel(model, webSearch);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (props.hasApiKey()) {
            headers.setBearerAuth(props.getApiKey());
        }
        HttpEntity<String> request = new HttpEntity<>(requestBody(wireModel, messages).toString(), headers);

        try {
            ResponseEntity<String> resp = restTemplate.exchange(
                    props.getApiUrl(), HttpMethod.POST, request, String.class);
            JSONObject root = parseBody(resp.getBody());
            ModelQueryError embedded = embeddedError(model, root);
            if (embedded != null) {
                return ModelCallResult.failure(embedded);
            }
            String content = extractContent(root);
            if (LOG.isDebugEnabled()) {
                LOG.debug("Model {} replied: {}", wireModel, LogSanitizer.preview(content));
            }
            return ModelCallResult.success(model, content);
        } catch (JSONException e) {
            return ModelCallResult.failure(
                    ModelQueryError.of(model, ErrorKind.UNKNOWN, "Malformed response: " + e.getMessage()));
        } catch (RestClientException e) {
            ModelQueryError error = ModelErrorClassifier.classify(model, e);
            LOG.debug("Model {} call failed: kind={}, message={}", wireModel, error.kind().wireName(),
                    error.message());
            return ModelCallResult.failure(error);
        }
    }

    static JSONObject requestBody(String wireModel, List<ChatMessage> messages) {
        JSONArray arr = new JSONArray();
        for (ChatMessage m : messages) {
            arr.put(new JSONObject().put("role", m.role()).put("content", m.content()));
        }
        return new JSONObject().put("model", wireModel).put("messages", arr);
    }

    static JSONObject parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new JSONException("empty body");
        }
        return new JSONObject(body);
    }

    /**
     * OpenRouter may answer 200 with an {@code error} object instead of choices; its
     * {@code code} is an HTTP-style status.
     */
    static ModelQueryError embeddedError(String model, JSONObject root) {
        JSONObject error = root.optJSONObject("error");
        if (error == null) {
            return null;
        }
        int code = error.optInt("code", 0);
        String message = error.optString("message", "Provider error");
        return new ModelQueryError(model, ErrorKind.fromStatus(code), message, code == 0 ? null : code);
    }

    /**
     * Reads {@code choices[0].message.content}; a missing or null content is an empty answer.
     */
    static String extractContent(JSONObject root) {
        JSONObject message = root.getJSONArray("choices").getJSONObject(0).getJSONObject("message");
        return message.optString("content", "");
    }
}
