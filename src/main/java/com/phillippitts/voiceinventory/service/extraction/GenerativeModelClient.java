package com.phillippitts.voiceinventory.service.extraction;

/**
 * Text-in, text-out generative model.
 */
public interface GenerativeModelClient {

    /**
     * Runs one generation.
     *
     * @return the raw model text
     * @throws com.phillippitts.voiceinventory.exception.ExtractionException on transport, quota,
     *         safety or response-shape failures
     */
    String generate(String systemPrompt, String userPrompt);

    /**
     * Model identifier used for metrics tags and logs.
     */
    String modelName();
}
