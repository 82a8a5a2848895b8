package com.phillippitts.voiceinventory.service.extraction;

import com.phillippitts.voiceinventory.config.properties.GeminiProperties;
import com.phillippitts.voiceinventory.exception.ExtractionException;
import com.phillippitts.voiceinventory.exception.ExtractionExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * {@link GenerativeModelClient} for the Gemini {@code generateContent} REST endpoint.
 *
 * <p>Requests ask for a JSON response ({@code responseMimeType=application/json}). Failures map to
 * {@link ExtractionException.Kind}s: 429 is {@code RATE_LIMITED}; 5xx and I/O errors are
 * {@code NETWORK}; 401 and 403 are {@code NOT_CONFIGURED}; any other 4xx is {@code UPSTREAM_REJECTED};
 * blocked prompts and {@code SAFETY} stops are {@code CONTENT_FILTERED}; a response
 * without text is {@code MALFORMED_RESPONSE}.
 */
public class GeminiGenerativeModelClient implements GenerativeModelClient {

    private static final Logger LOG = LogManager.getLogger(GeminiGenerativeModelClient.class);

    private final RestTemplate restTemplate;
    private final GeminiProperties properties;

    public GeminiGenerativeModelClient(RestTemplate restTemplate, GeminiProperties properties) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    @Override
    public String modelName() {
        return properties.getModel();
    }

    @Override
    public String generate(String systemPrompt, String userPrompt) {
        if (!properties.isConfigured()) {
            throw new ExtractionException(ExtractionException.Kind.NOT_CONFIGURED,
                    "Gemini API key is not configured (gemini.api-key)");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", properties.getApiKey());

        String url = properties.getBaseUrl() + "/models/" + properties.getModel() + ":generateContent";
        String body = buildRequest(systemPrompt, userPrompt).toString();

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            throw ExtractionExceptionBuilder.create("Gemini request failed")
                    .kind(kindForStatus(status))
                    .status(status)
                    .metadata("model", properties.getModel())
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw ExtractionExceptionBuilder.create("Gemini endpoint unreachable")
                    .kind(ExtractionException.Kind.NETWORK)
                    .metadata("model", properties.getModel())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw ExtractionExceptionBuilder.create("Gemini request failed")
                    .kind(ExtractionException.Kind.NETWORK)
                    .metadata("model", properties.getModel())
                    .cause(e)
                    .build();
        }
        return extractText(response.getBody());
    }

    static ExtractionException.Kind kindForStatus(int status) {
        if (status == 429) {
            return ExtractionException.Kind.RATE_LIMITED;
        }
        if (status >= 500) {
            return ExtractionException.Kind.NETWORK;
        }
        // a rejected or expired key
        if (status == 401 || status == 403) {
            return ExtractionException.Kind.NOT_CONFIGURED;
        }
        return ExtractionException.Kind.UPSTREAM_REJECTED;
    }

    JSONObject buildRequest(String systemPrompt, String userPrompt) {
        JSONObject request = new JSONObject();
        request.put("systemInstruction", new JSONObject()
                .put("parts", new JSONArray().put(new JSONObject().put("text", systemPrompt))));
        request.put("contents", new JSONArray().put(new JSONObject()
                .put("role", "user")
                .put("parts", new JSONArray().put(new JSONObject().put("text", userPrompt)))));
        request.put("generationConfig", new JSONObject()
                .put("temperature", properties.getTemperature())
                .put("responseMimeType", "application/json"));
        return request;
    }

    String extractText(String body) {
        if (body == null || body.isBlank()) {
            throw malformed("Empty Gemini response");
        }
        try {
            JSONObject root = new JSONObject(body);
            JSONObject feedback = root.optJSONObject("promptFeedback");
            if (feedback != null && feedback.has("blockReason")) {
                throw ExtractionExceptionBuilder.create("Prompt blocked by Gemini")
                        .kind(ExtractionException.Kind.CONTENT_FILTERED)
                        .metadata("reason", feedback.optString("blockReason"))
                        .build();
            }
            JSONArray candidates = root.optJSONArray("candidates");
            if (candidates == null || candidates.isEmpty()) {
                throw malformed("Gemini response has no candidates");
            }
            JSONObject candidate = candidates.getJSONObject(0);
            String finishReason = candidate.optString("finishReason", "");
            if ("SAFETY".equals(finishReason) || "PROHIBITED_CONTENT".equals(finishReason)) {
                throw ExtractionExceptionBuilder.create("Response withheld by Gemini")
                        .kind(ExtractionException.Kind.CONTENT_FILTERED)
                        .metadata("reason", finishReason)
                        .build();
            }
            JSONObject content = candidate.optJSONObject("content");
            JSONArray parts = content == null ? null : content.optJSONArray("parts");
            if (parts == null || parts.isEmpty()) {
                throw malformed("Gemini candidate has no content parts");
            }
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < parts.length(); i++) {
                text.append(parts.getJSONObject(i).optString("text", ""));
            }
            if (text.length() == 0) {
                throw malformed("Gemini candidate has no text");
            }
            LOG.debug("Gemini returned {} characters (finishReason={})", text.length(), finishReason);
            return text.toString();
        } catch (JSONException e) {
            throw ExtractionExceptionBuilder.create("Unparseable Gemini response")
                    .kind(ExtractionException.Kind.MALFORMED_RESPONSE)
                    .cause(e)
                    .build();
        }
    }

    private static ExtractionException malformed(String message) {
        return new ExtractionException(ExtractionException.Kind.MALFORMED_RESPONSE, message);
    }
}
