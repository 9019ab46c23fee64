package com.eainde.slopstopper.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.request.json.JsonSchema;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * The versioned verdict contract: the JSON Schema document on the classpath, plus its
 * LangChain4j form for structured output.
 */
public final class AnalysisSchema {

    public static final String V1 = "v1";
    private static final String RESOURCE_PATTERN = "/schema/video-analysis-%s.schema.json";

    private final String version;
    private final JsonNode definition;
    private final String definitionText;
    private final JsonSchema responseSchema;

    private AnalysisSchema(String version, JsonNode definition, String definitionText) {
        this.version = version;
        this.definition = definition;
        this.definitionText = definitionText;
        this.responseSchema = JsonSchemaConverter.toLangChainSchema("VideoAnalysis", definition);
    }

    public static AnalysisSchema load(String version, ObjectMapper objectMapper) {
        String resource = RESOURCE_PATTERN.formatted(version);
        try (InputStream in = AnalysisSchema.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Analysis schema not found on classpath: " + resource);
            }
            JsonNode definition = objectMapper.readTree(in);
            return new AnalysisSchema(version, definition, objectMapper.writeValueAsString(definition));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load analysis schema " + resource, e);
        }
    }

    public String version() {
        return version;
    }

    public JsonNode definition() {
        return definition;
    }

    /**
     * Compact JSON of the schema, for embedding in prompts.
     */
    public String definitionText() {
        return definitionText;
    }

    public JsonSchema responseSchema() {
        return responseSchema;
    }
}
