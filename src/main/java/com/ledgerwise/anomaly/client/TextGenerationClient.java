package com.ledgerwise.anomaly.client;

/**
 * Narrow collaborator for the external text-generation service.
 */
public interface TextGenerationClient {

    /**
     * Send a prompt and return the free-text answer.
     *
     * @throws com.ledgerwise.anomaly.exception.TextGenerationException when the call fails or
     *         the answer is empty
     */
    String generate(TextGenerationRequest request);
}
