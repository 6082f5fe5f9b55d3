package com.account.relationship.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Serializes assessment payloads to JSON.
 */
public class AssessmentPayloadWriter {

    private final ObjectMapper objectMapper;

    public AssessmentPayloadWriter() {
        this(new ObjectMapper());
    }

    public AssessmentPayloadWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(AssessmentPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AssessmentException("Failed to serialize payload for record " + payload.getRecordId(), e);
        }
    }

    /**
     * Indented form, as embedded in the scoring prompt.
     */
    public String writePretty(AssessmentPayload payload) {
        try {
            return objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new AssessmentException("Failed to serialize payload for record " + payload.getRecordId(), e);
        }
    }
}
