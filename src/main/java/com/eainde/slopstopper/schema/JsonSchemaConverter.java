package com.eainde.slopstopper.schema;

import com.fasterxml.jackson.databind.JsonNode;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the verdict's JSON Schema document into LangChain4j's {@link JsonSchema}, the form
 * response formats travel in.
 * <p>
 * Only the subset the verdict schemas use is accepted: objects, arrays, string enums and the
 * scalar types. LangChain4j elements carry no numeric bounds, so {@code minimum}/{@code maximum}
 * of an integer are appended to its description; {@link AnalysisSchemaValidator} enforces them.
 * Failures name the offending property path.
 */
public final class JsonSchemaConverter {

    private static final String ROOT = "$";

    private JsonSchemaConverter() {
    }

    public static JsonSchema toLangChainSchema(String name, JsonNode definition) {
        return JsonSchema.builder()
                .name(name)
                .rootElement(convert(definition, ROOT))
                .build();
    }

    private static JsonSchemaElement convert(JsonNode node, String path) {
        String type = node.path("type").asText(node.has("properties") ? "object" : "");
        String description = text(node, "description");
        switch (type) {
            case "object":
                return object(node, path, description);
            case "array":
                if (!node.has("items")) {
                    throw new IllegalArgumentException(path + ": array without items");
                }
                return JsonArraySchema.builder()
                        .description(description)
                        .items(convert(node.get("items"), path + "[]"))
                        .build();
            case "string":
                if (node.has("enum")) {
                    return JsonEnumSchema.builder()
                            .description(description)
                            .enumValues(strings(node.get("enum")))
                            .build();
                }
                return JsonStringSchema.builder().description(description).build();
            case "integer":
                return JsonIntegerSchema.builder().description(withBounds(node, description)).build();
            case "number":
                return JsonNumberSchema.builder().description(withBounds(node, description)).build();
            case "boolean":
                return JsonBooleanSchema.builder().description(description).build();
            case "":
                throw new IllegalArgumentException(path + ": schema node without type");
            default:
                throw new IllegalArgumentException(path + ": unsupported schema type '" + type + "'");
        }
    }

    private static JsonObjectSchema object(JsonNode node, String path, String description) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
        JsonNode properties = node.path("properties");
        properties.fieldNames().forEachRemaining(property ->
                builder.addProperty(property, convert(properties.get(property), path + "." + property)));

        List<String> required = strings(node.path("required"));
        for (String property : required) {
            if (!properties.has(property)) {
                throw new IllegalArgumentException(path + ": required property '" + property + "' is not declared");
            }
        }
        if (!required.isEmpty()) {
            builder.required(required);
        }
        return builder.build();
    }

    private static String withBounds(JsonNode node, String description) {
        if (!node.has("minimum") && !node.has("maximum")) {
            return description;
        }
        String range = "Range: " + (node.has("minimum") ? node.get("minimum").asText() : "")
                + ".." + (node.has("maximum") ? node.get("maximum").asText() : "") + ".";
        return description == null ? range : description + " " + range;
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(value -> values.add(value.asText()));
        return values;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
