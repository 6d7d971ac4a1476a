package com.phillippitts.captionhub.service.translation;

import com.phillippitts.captionhub.config.properties.TranslationProperties;
import com.phillippitts.captionhub.domain.Language;
import com.phillippitts.captionhub.exception.TranslationException;
import com.phillippitts.captionhub.exception.TranslationException.FailureKind;
import com.phillippitts.captionhub.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Translation client for OpenAI-compatible {@code /v1/chat/completions} endpoints.
 *
 * <p>Each request carries an interpreter system prompt, the preceding source segments as
 * earlier user turns, and the segment to translate as the final user turn. HTTP status codes
 * are mapped onto {@link FailureKind}s:
 * <ul>
 *   <li>429 - {@code RATE_LIMITED} (transient)</li>
 *   <li>5xx - {@code SERVER_ERROR} (transient)</li>
 *   <li>other 4xx - {@code INVALID_INPUT}</li>
 *   <li>I/O failure - {@code NETWORK} (transient); request timeout - {@code TIMEOUT}</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "translation", name = "provider", havingValue = "openai")
public class OpenAiTranslationClient implements TranslationClient {

    private static final Logger LOG = LogManager.getLogger(OpenAiTranslationClient.class);

    private static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final TranslationProperties properties;
    private final HttpClient httpClient;
    private final URI endpoint;

    @Autowired
    public OpenAiTranslationClient(TranslationProperties properties) {
        this(properties, HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getOpenai().getConnectTimeoutMs()))
                .build());
    }

    /** Visible for tests. */
    OpenAiTranslationClient(TranslationProperties properties, HttpClient httpClient) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        String base = properties.getOpenai().getBaseUrl();
        this.endpoint = URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) + COMPLETIONS_PATH
                : base + COMPLETIONS_PATH);
        if (properties.getOpenai().getApiKey() == null || properties.getOpenai().getApiKey().isBlank()) {
            LOG.warn("translation.openai.api-key is empty; requests to {} will likely be rejected", endpoint);
        }
        LOG.info("OpenAI translation client ready: endpoint={}, model={}", endpoint, properties.getOpenai().getModel());
    }

    @Override
    public String translate(TranslationRequest request) {
        String target = request.targetLanguage();
        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                .header("Authorization", "Bearer " + properties.getOpenai().getApiKey())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(buildBody(request).toString(), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TranslationException("Translation request timed out", FailureKind.TIMEOUT, target, e);
        } catch (IOException e) {
            throw new TranslationException("Translation request failed: " + e.getMessage(),
                    FailureKind.NETWORK, target, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Translation request interrupted", FailureKind.TIMEOUT, target, e);
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            throw new TranslationException("Translation endpoint returned HTTP " + status,
                    classifyStatus(status), target);
        }
        String translated = parseContent(response.body(), target);
        LOG.debug("Translated seq={} -> {}: \"{}\"", request.sequence(), target, LogSanitizer.preview(translated));
        return translated;
    }

    @Override
    public String name() {
        return "openai";
    }

    JSONObject buildBody(TranslationRequest request) {
        JSONArray messages = new JSONArray();
        messages.put(message("system", systemPrompt(request.sourceLanguage(), request.targetLanguage())));
        for (String previous : request.context()) {
            messages.put(message("user", previous));
        }
        messages.put(message("user", request.text()));

        JSONObject body = new JSONObject();
        body.put("model", properties.getOpenai().getModel());
        body.put("temperature", properties.getOpenai().getTemperature());
        body.put("stream", false);
        body.put("messages", messages);
        return body;
    }

    static String systemPrompt(String sourceLanguage, String targetLanguage) {
        String source = displayName(sourceLanguage);
        String target = displayName(targetLanguage);
        return "You are a professional simultaneous interpreter. "
                + "Translate the provided " + source + " text to " + target + ". "
                + "Rules: 1) Translate ONLY the most recent message; earlier messages are context. "
                + "2) Use natural, spoken language appropriate for live captions. "
                + "3) Return ONLY the translation, no explanations. "
                + "4) Maintain the tone and meaning of the original.";
    }

    static FailureKind classifyStatus(int status) {
        if (status == 429) {
            return FailureKind.RATE_LIMITED;
        }
        if (status == 408) {
            return FailureKind.TIMEOUT;
        }
        if (status >= 500) {
            return FailureKind.SERVER_ERROR;
        }
        return FailureKind.INVALID_INPUT;
    }

    private static String parseContent(String body, String target) {
        try {
            JSONArray choices = new JSONObject(body).optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw new TranslationException("Translation response has no choices", FailureKind.UNKNOWN, target);
            }
            String content = choices.getJSONObject(0).getJSONObject("message").optString("content", "").trim();
            if (content.isEmpty()) {
                throw new TranslationException("Translation response is empty", FailureKind.UNKNOWN, target);
            }
            return content;
        } catch (JSONException e) {
            throw new TranslationException("Malformed translation response", FailureKind.UNKNOWN, target, e);
        }
    }

    private static JSONObject message(String role, String content) {
        return new JSONObject().put("role", role).put("content", content);
    }

    private static String displayName(String code) {
        return Language.find(code).map(Language::name).orElse(code);
    }
}
