package com.ledgerwise.anomaly.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.ledgerwise.anomaly.config.EnrichmentConfig;
import com.ledgerwise.anomaly.exception.TextGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts {@code {message, context: {userRole, businessContext}}} to the configured endpoint and
 * returns the {@code response} field of the JSON answer.
 */
@Component
public class RestTextGenerationClient implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(RestTextGenerationClient.class);

    private final RestTemplate restTemplate;
    private final EnrichmentConfig config;

    public RestTextGenerationClient(RestTemplateBuilder builder, EnrichmentConfig config) {
        this.config = config;
        this.restTemplate = builder
                .setConnectTimeout(config.getConnectTimeout())
                .setReadTimeout(config.getDefaultTimeout())
                .build();
    }

    @Override
    public String generate(TextGenerationRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            headers.setBearerAuth(config.getApiKey());
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("userRole", request.getUserRole());
        context.put("businessContext", request.getBusinessContext());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", request.getPrompt());
        body.put("context", context);

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(
                    config.getUrl(), HttpMethod.POST, new HttpEntity<>(body, headers), JsonNode.class);

            JsonNode payload = response.getBody();
            if (payload == null || !payload.hasNonNull("response")) {
                throw new TextGenerationException("Text generation answer has no 'response' field");
            }
            String text = payload.get("response").asText();
            if (text.isBlank()) {
                throw new TextGenerationException("Text generation answer is empty");
            }
            log.debug("Text generation returned {} chars", text.length());
            return text;
        } catch (RestClientException e) {
            throw new TextGenerationException("Text generation call failed: " + e.getMessage(), e);
        }
    }
}
