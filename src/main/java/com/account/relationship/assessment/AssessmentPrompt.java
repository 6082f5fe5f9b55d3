package com.account.relationship.assessment;

import com.account.relationship.config.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Prompts sent to a language-model based {@link ConfidenceScorer}. The system prompt describes
 * every payload field, its trust tier and the expected JSON reply; it is loaded from the
 * classpath once.
 */
public class AssessmentPrompt {

    public static final String DEFAULT_RESOURCE = "assessment-system-prompt.txt";
    static final String USER_PROMPT_PREFIX = "Please assess this account relationship:\n\n";

    private final String systemPrompt;
    private final AssessmentPayloadWriter writer;

    public AssessmentPrompt() {
        this(DEFAULT_RESOURCE, new AssessmentPayloadWriter());
    }

    public AssessmentPrompt(String resource, AssessmentPayloadWriter writer) {
        this.systemPrompt = load(resource);
        this.writer = Objects.requireNonNull(writer, "writer is required");
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public String userPrompt(AssessmentPayload payload) {
        return USER_PROMPT_PREFIX + writer.writePretty(payload);
    }

    private static String load(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = AssessmentPrompt.class.getClassLoader();
        }
        try (InputStream input = loader.getResourceAsStream(resource)) {
            if (input == null) {
                throw new ConfigurationException("System prompt resource not found: " + resource);
            }
            String text = new String(input.readAllBytes(), StandardCharsets.UTF_8).trim();
            if (text.isEmpty()) {
                throw new ConfigurationException("System prompt resource is empty: " + resource);
            }
            return text;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read system prompt " + resource, e);
        }
    }
}
