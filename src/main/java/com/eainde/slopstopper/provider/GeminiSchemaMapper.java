package com.eainde.slopstopper.provider;

import com.google.genai.types.Schema;
import com.google.genai.types.Type;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps LangChain4j structured-output elements onto the Gemini {@link Schema} sent as
 * {@code responseSchema}. Property order is kept and passed as {@code propertyOrdering},
 * so the model emits fields in declaration order.
 */
final class GeminiSchemaMapper {

    private GeminiSchemaMapper() {
    }

    static Schema toGeminiSchema(JsonSchemaElement element) {
        if (element instanceof JsonObjectSchema objectSchema) {
            Map<String, Schema> properties = new LinkedHashMap<>();
            if (objectSchema.properties() != null) {
                objectSchema.properties().forEach((name, property) -> properties.put(name, toGeminiSchema(property)));
            }
            Schema.Builder builder = Schema.builder()
                    .type(Type.Known.OBJECT)
                    .properties(properties)
                    .propertyOrdering(new ArrayList<>(properties.keySet()));
            if (objectSchema.required() != null && !objectSchema.required().isEmpty()) {
                builder.required(objectSchema.required());
            }
            return describe(builder, objectSchema.description());
        }
        if (element instanceof JsonArraySchema arraySchema) {
            return describe(Schema.builder()
                    .type(Type.Known.ARRAY)
                    .items(toGeminiSchema(arraySchema.items())), arraySchema.description());
        }
        if (element instanceof JsonEnumSchema enumSchema) {
            return describe(Schema.builder()
                    .type(Type.Known.STRING)
                    .format("enum")
                    .enum_(enumSchema.enumValues()), enumSchema.description());
        }
        if (element instanceof JsonStringSchema stringSchema) {
            return describe(Schema.builder().type(Type.Known.STRING), stringSchema.description());
        }
        if (element instanceof JsonIntegerSchema integerSchema) {
            return describe(Schema.builder().type(Type.Known.INTEGER), integerSchema.description());
        }
        if (element instanceof JsonNumberSchema numberSchema) {
            return describe(Schema.builder().type(Type.Known.NUMBER), numberSchema.description());
        }
        if (element instanceof JsonBooleanSchema booleanSchema) {
            return describe(Schema.builder().type(Type.Known.BOOLEAN), booleanSchema.description());
        }
        throw new IllegalArgumentException("No Gemini schema mapping for " + element);
    }

    private static Schema describe(Schema.Builder builder, String description) {
        if (description != null) {
            builder.description(description);
        }
        return builder.build();
    }
}
