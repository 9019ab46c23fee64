package com.eainde.slopstopper.provider;

import com.eainde.slopstopper.error.TransportException;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.GenerateContentResponseUsageMetadata;
import com.google.genai.types.HttpOptions;
import com.google.genai.types.Part;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static dev.langchain4j.model.chat.Capability.RESPONSE_FORMAT_JSON_SCHEMA;
import static java.util.Collections.singletonList;

/**
 * A LangChain4j {@link ChatModel} backed by the Google Gen AI SDK ({@code com.google.genai}).
 * <p>
 * Makes exactly one call per {@link #chat(ChatRequest)}; retries and backoff belong to the caller.
 * A JSON response format with a schema is sent as Gemini's {@code responseSchema}.
 * SDK failures are translated into {@link TransportException}, flagged retryable for
 * 408/429/5xx and network errors, non-retryable for other 4xx.
 */
public class GeminiChatModel implements ChatModel {

    private static final Logger log = LoggerFactory.getLogger(GeminiChatModel.class);

    private final Client client;
    private final String modelName;
    private final Double temperature;
    private final boolean logRequests;

    private GeminiChatModel(Builder builder) {
        if (builder.modelName == null || builder.modelName.isBlank()) {
            throw new IllegalArgumentException("modelName is mandatory");
        }
        this.modelName = builder.modelName;
        this.temperature = builder.temperature;
        this.logRequests = builder.logRequests != null && builder.logRequests;

        if (builder.client != null) {
            this.client = builder.client;
        } else {
            HttpOptions.Builder httpOptions = HttpOptions.builder();
            if (builder.timeout != null) {
                httpOptions.timeout((int) builder.timeout.toMillis());
            }
            this.client = Client.builder()
                    .apiKey(builder.apiKey)
                    .httpOptions(httpOptions.build())
                    .build();
        }
    }

    @Override
    public Set<Capability> supportedCapabilities() {
        return Set.of(RESPONSE_FORMAT_JSON_SCHEMA);
    }

    @Override
    public ChatResponse doChat(ChatRequest request) {
        String model = request.modelName() != null ? request.modelName() : modelName;

        // --- 1. Map messages: system text goes to the config, the rest become contents ---
        List<Content> contents = new ArrayList<>();
        StringBuilder systemInstruction = new StringBuilder();

        for (ChatMessage message : request.messages()) {
            if (message instanceof SystemMessage systemMessage) {
                if (systemInstruction.length() > 0) systemInstruction.append("\n");
                systemInstruction.append(systemMessage.text());
            } else if (message instanceof UserMessage userMessage) {
                contents.add(toContent("user", userMessage.singleText()));
            } else if (message instanceof AiMessage aiMessage) {
                contents.add(toContent("model", aiMessage.text()));
            } else {
                throw new IllegalArgumentException("Unsupported message type: " + message.type());
            }
        }

        // --- 2. Build request config ---
        GenerateContentConfig.Builder configBuilder = GenerateContentConfig.builder();
        Double effectiveTemperature = request.temperature() != null ? request.temperature() : temperature;
        if (effectiveTemperature != null) {
            configBuilder.temperature(effectiveTemperature.floatValue());
        }
        if (systemInstruction.length() > 0) {
            configBuilder.systemInstruction(Content.builder()
                    .parts(singletonList(Part.builder().text(systemInstruction.toString()).build()))
                    .build());
        }
        ResponseFormat responseFormat = request.responseFormat();
        if (responseFormat != null && responseFormat.type() == ResponseFormatType.JSON) {
            configBuilder.responseMimeType("application/json");
            if (responseFormat.jsonSchema() != null) {
                configBuilder.responseSchema(
                        GeminiSchemaMapper.toGeminiSchema(responseFormat.jsonSchema().rootElement()));
            }
        }

        if (logRequests) {
            log.info("Gemini request: model={}, msgCount={}, systemChars={}",
                    model, request.messages().size(), systemInstruction.length());
        }

        // --- 3. Execute ---
        GenerateContentResponse result;
        try {
            result = client.models.generateContent(model, contents, configBuilder.build());
        } catch (ApiException e) {
            throw new TransportException("Gemini returned " + e.code() + ": " + e.getMessage(),
                    isRetryable(e.code()), e);
        } catch (RuntimeException e) {
            throw new TransportException("Gemini call failed: " + e.getMessage(), true, e);
        }

        // --- 4. Map response ---
        String text = result.text();
        TokenUsage tokenUsage = result.usageMetadata()
                .map(GeminiChatModel::toTokenUsage)
                .orElse(new TokenUsage(0, 0));

        log.debug("Gemini response: model={}, chars={}, tokens={}", model,
                text == null ? 0 : text.length(), tokenUsage);

        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text == null ? "" : text))
                .tokenUsage(tokenUsage)
                .modelName(model)
                .build();
    }

    static boolean isRetryable(int httpCode) {
        return httpCode == 408 || httpCode == 429 || httpCode >= 500;
    }

    private static Content toContent(String role, String text) {
        return Content.builder()
                .role(role)
                .parts(singletonList(Part.builder().text(text).build()))
                .build();
    }

    private static TokenUsage toTokenUsage(GenerateContentResponseUsageMetadata usage) {
        return new TokenUsage(
                usage.promptTokenCount().orElse(0),
                usage.candidatesTokenCount().orElse(0));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Client client;
        private String apiKey;
        private String modelName;
        private Double temperature;
        private Duration timeout;
        private Boolean logRequests;

        /**
         * Pre-built client; when set, {@code apiKey} and {@code timeout} are ignored.
         */
        public Builder client(Client client) {
            this.client = client;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logRequests(Boolean logRequests) {
            this.logRequests = logRequests;
            return this;
        }

        public GeminiChatModel build() {
            return new GeminiChatModel(this);
        }
    }
}
