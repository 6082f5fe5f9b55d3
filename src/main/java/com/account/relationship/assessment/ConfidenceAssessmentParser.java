package com.account.relationship.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses a scorer's text reply into a {@link ConfidenceAssessment}.
 *
 * <p>The reply is read as strict JSON first. Failing that, the first balanced {@code {...}}
 * block in the text is tried, which recovers replies wrapped in prose or code fences.
 * A reply that still cannot be used yields a failed assessment; this parser never throws.</p>
 */
public class ConfidenceAssessmentParser {
    private static final Logger log = LoggerFactory.getLogger(ConfidenceAssessmentParser.class);

    static final String SCORE_FIELD = "confidence_score";
    static final String BULLETS_FIELD = "explanation_bullets";

    private final ObjectMapper objectMapper;

    public ConfidenceAssessmentParser() {
        this(new ObjectMapper());
    }

    public ConfidenceAssessmentParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ConfidenceAssessment parse(String response) {
        if (response == null || response.isBlank()) {
            return ConfidenceAssessment.failed("Empty response from confidence scorer", response);
        }

        Optional<JsonNode> node = readJson(response.trim());
        if (node.isEmpty()) {
            node = firstJsonObject(response).flatMap(this::readJson);
        }
        if (node.isEmpty()) {
            log.debug("assessment.unparseable length={}", response.length());
            return ConfidenceAssessment.failed("Failed to parse scorer response as JSON", response);
        }
        return fromNode(node.get(), response);
    }

    private ConfidenceAssessment fromNode(JsonNode node, String response) {
        if (!node.isObject()) {
            return ConfidenceAssessment.failed("Scorer response is not a JSON object", response);
        }

        JsonNode scoreNode = node.get(SCORE_FIELD);
        if (scoreNode == null || scoreNode.isNull()) {
            return ConfidenceAssessment.failed("Scorer response has no " + SCORE_FIELD, response);
        }
        Optional<Double> score = numericValue(scoreNode);
        if (score.isEmpty()) {
            return ConfidenceAssessment.failed(SCORE_FIELD + " is not a number: " + scoreNode.asText(), response);
        }

        JsonNode bulletsNode = node.get(BULLETS_FIELD);
        if (bulletsNode == null || !bulletsNode.isArray()) {
            return ConfidenceAssessment.failed("Scorer response has no " + BULLETS_FIELD + " array", response);
        }
        List<String> bullets = new ArrayList<>();
        for (JsonNode bullet : bulletsNode) {
            String text = bullet.isTextual() ? bullet.textValue() : bullet.toString();
            if (!text.isBlank()) {
                bullets.add(text.trim());
            }
        }

        long rounded = Math.round(score.get());
        int clamped = (int) Math.max(0, Math.min(100, rounded));
        if (clamped != rounded) {
            log.debug("assessment.score-clamped raw={} clamped={}", score.get(), clamped);
        }
        return ConfidenceAssessment.of(clamped, bullets, response);
    }

    private Optional<JsonNode> readJson(String text) {
        try {
            return Optional.ofNullable(objectMapper.readTree(text));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static Optional<Double> numericValue(JsonNode node) {
        if (node.isNumber()) {
            return Optional.of(node.doubleValue());
        }
        if (node.isTextual()) {
            try {
                return Optional.of(Double.parseDouble(node.textValue().trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first balanced brace block, skipping braces inside JSON strings.
     */
    static Optional<String> firstJsonObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }
}
