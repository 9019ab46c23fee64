package com.eainde.slopstopper.schema;

import com.eainde.slopstopper.error.SchemaViolationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Checks raw provider output against the {@link AnalysisSchema} document before anything
 * downstream trusts it.
 * <p>
 * Supported keywords: {@code type}, {@code properties}, {@code required}, {@code enum},
 * {@code items}, {@code minimum}, {@code maximum}. Values are never coerced: {@code "95"} is not an
 * integer, {@code 95.0} is not an integer, {@code "true"} is not a boolean. Fields the schema does not
 * declare are allowed and left in the payload. Optional fields may be {@code null}.
 */
public class AnalysisSchemaValidator {

    private static final String ROOT = "$";

    private final AnalysisSchema schema;
    private final ObjectMapper objectMapper;

    public AnalysisSchemaValidator(AnalysisSchema schema, ObjectMapper objectMapper) {
        this.schema = schema;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws SchemaViolationException on the first violation found
     */
    public ValidatedVerdict validate(String rawOutput) {
        JsonNode payload = parse(rawOutput);
        return validate(payload);
    }

    public ValidatedVerdict validate(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new SchemaViolationException(ROOT, "expected a JSON object but was "
                    + (payload == null ? "nothing" : describe(payload)));
        }
        check(schema.definition(), payload, ROOT);

        try {
            VideoAnalysis analysis = objectMapper.treeToValue(payload, VideoAnalysis.class);
            return new ValidatedVerdict(schema.version(), analysis, payload, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            // schema resource and VideoAnalysis disagree
            throw new SchemaViolationException(ROOT, "does not bind to VideoAnalysis: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode parse(String rawOutput) {
        if (rawOutput == null || rawOutput.isBlank()) {
            throw new SchemaViolationException(ROOT, "empty response");
        }
        try {
            return objectMapper.readTree(stripCodeFence(rawOutput.trim()));
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException(ROOT, "is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Some models wrap JSON in a markdown fence even in JSON mode.
     */
    static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }

    private void check(JsonNode schemaNode, JsonNode value, String path) {
        String type = schemaNode.path("type").asText("object");
        switch (type) {
            case "object" -> checkObject(schemaNode, value, path);
            case "array" -> checkArray(schemaNode, value, path);
            case "string" -> checkString(schemaNode, value, path);
            case "integer" -> checkInteger(schemaNode, value, path);
            case "number" -> {
                if (!value.isNumber()) throw mismatch(path, "number", value);
            }
            case "boolean" -> {
                if (!value.isBoolean()) throw mismatch(path, "boolean", value);
            }
            default -> throw new IllegalStateException("Unsupported schema type '" + type + "' at " + path);
        }
    }

    private void checkObject(JsonNode schemaNode, JsonNode value, String path) {
        if (!value.isObject()) {
            throw mismatch(path, "object", value);
        }
        List<String> required = new ArrayList<>();
        schemaNode.path("required").forEach(n -> required.add(n.asText()));
        for (String field : required) {
            JsonNode child = value.get(field);
            if (child == null || child.isNull()) {
                throw new SchemaViolationException(child(path, field), "is required but missing");
            }
        }

        Iterator<Map.Entry<String, JsonNode>> properties = schemaNode.path("properties").fields();
        while (properties.hasNext()) {
            Map.Entry<String, JsonNode> property = properties.next();
            JsonNode child = value.get(property.getKey());
            if (child != null && !child.isNull()) {
                check(property.getValue(), child, child(path, property.getKey()));
            }
        }
    }

    private void checkArray(JsonNode schemaNode, JsonNode value, String path) {
        if (!value.isArray()) {
            throw mismatch(path, "array", value);
        }
        JsonNode items = schemaNode.get("items");
        if (items == null) {
            return;
        }
        for (int i = 0; i < value.size(); i++) {
            JsonNode element = value.get(i);
            if (element.isNull()) {
                throw new SchemaViolationException(path + "[" + i + "]", "must not be null");
            }
            check(items, element, path + "[" + i + "]");
        }
    }

    private void checkString(JsonNode schemaNode, JsonNode value, String path) {
        if (!value.isTextual()) {
            throw mismatch(path, "string", value);
        }
        JsonNode allowed = schemaNode.get("enum");
        if (allowed == null) {
            return;
        }
        for (JsonNode option : allowed) {
            if (option.asText().equals(value.asText())) {
                return;
            }
        }
        throw new SchemaViolationException(path, "value '" + value.asText() + "' is not one of " + allowed);
    }

    private void checkInteger(JsonNode schemaNode, JsonNode value, String path) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw mismatch(path, "integer", value);
        }
        long number = value.asLong();
        if (schemaNode.has("minimum") && number < schemaNode.get("minimum").asLong()) {
            throw new SchemaViolationException(path, "value " + number + " is below minimum "
                    + schemaNode.get("minimum").asLong());
        }
        if (schemaNode.has("maximum") && number > schemaNode.get("maximum").asLong()) {
            throw new SchemaViolationException(path, "value " + number + " is above maximum "
                    + schemaNode.get("maximum").asLong());
        }
    }

    private static SchemaViolationException mismatch(String path, String expected, JsonNode actual) {
        return new SchemaViolationException(path, "expected " + expected + " but was " + describe(actual));
    }

    private static String describe(JsonNode node) {
        return node.getNodeType().name().toLowerCase();
    }

    private static String child(String path, String field) {
        return ROOT.equals(path) ? field : path + "." + field;
    }
}
