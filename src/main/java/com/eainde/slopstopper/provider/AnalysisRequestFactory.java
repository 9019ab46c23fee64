package com.eainde.slopstopper.provider;

import com.eainde.slopstopper.schema.AnalysisSchema;
import com.eainde.slopstopper.store.VideoRecord;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;

/**
 * Assembles the provider request for one record: persona and schema as the system message,
 * record metadata (and the transcript when fetched) as the user message.
 */
public class AnalysisRequestFactory {

    private final PersonaPrompt persona;
    private final AnalysisSchema schema;
    private final Double temperature;

    public AnalysisRequestFactory(PersonaPrompt persona, AnalysisSchema schema, Double temperature) {
        if (!persona.schemaVersion().equals(schema.version())) {
            throw new IllegalArgumentException("Persona targets schema " + persona.schemaVersion()
                    + " but schema " + schema.version() + " was supplied");
        }
        this.persona = persona;
        this.schema = schema;
        this.temperature = temperature;
    }

    public ChatRequest build(VideoRecord record, String modelName) {
        String system = persona.instructions()
                + "\n### OUTPUT SCHEMA\n"
                + schema.definitionText();

        return ChatRequest.builder()
                .messages(SystemMessage.from(system), UserMessage.from(describe(record)))
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(schema.responseSchema())
                        .build())
                .modelName(modelName)
                .temperature(temperature)
                .build();
    }

    static String describe(VideoRecord record) {
        StringBuilder sb = new StringBuilder("Analyze this video.\n");
        sb.append("Title: ").append(orUnknown(record.title())).append('\n');
        sb.append("Channel: ").append(orUnknown(record.channelName())).append('\n');
        sb.append("URL: ").append(orUnknown(record.url())).append('\n');
        if (record.hasTranscript()) {
            sb.append("\n### TRANSCRIPT\n").append(record.transcriptText()).append('\n');
        } else {
            sb.append("\nNo transcript is available; judge from the title, channel and your knowledge of the video.\n");
        }
        return sb.toString();
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? "(unknown)" : value;
    }
}
