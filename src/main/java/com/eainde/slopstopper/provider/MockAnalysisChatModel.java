package com.eainde.slopstopper.provider;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

/**
 * Offline stand-in for the provider: always answers with the same schema-valid verdict,
 * or with a fixed tie when asked for a {@value #JUDGE_SCHEMA_NAME} response.
 */
public class MockAnalysisChatModel implements ChatModel {

    public static final String MODEL_NAME = ProviderSettings.MODE_MOCK;
    public static final int INPUT_TOKENS = 100;
    public static final int OUTPUT_TOKENS = 50;
    public static final String JUDGE_SCHEMA_NAME = "JudgeVerdict";

    static final String JUDGE_VERDICT = """
            {"winner": "TIE", "reasoning": "Mock judge: both verdicts are identical.", "reconciled_action": "Approve"}
            """;

    static final String VERDICT = """
            {
              "visual_grounding": {
                "detected_entities": ["Person talking", "Whiteboard", "Text Overlay"],
                "setting": "Studio",
                "text_on_screen": "Mock analysis"
              },
              "video_metadata": {"format": "Standard_Landscape", "duration_perceived": "Medium (5-20 min)"},
              "content_taxonomy": {
                "primary_genre": "Education_STEM",
                "specific_topic": "Mock topic",
                "target_demographic": "Child (5-9)"
              },
              "narrative_quality": {
                "structural_integrity": "Coherent_Narrative",
                "creative_intent": "Informational",
                "weirdness_verdict": "Normal"
              },
              "cognitive_nutrition": {
                "intellectual_density": "High (Educational)",
                "emotional_volatility": "Calm",
                "is_brainrot": false,
                "is_slop": false
              },
              "risk_assessment": {
                "safety_score": 95,
                "flags": {
                  "ideological_radicalization": false,
                  "pseudoscience_misinfo": false,
                  "body_image_harm": false,
                  "dangerous_behavior": false,
                  "commercial_exploitation": false,
                  "lootbox_gambling": false,
                  "sexual_themes": false,
                  "mascot_horror": false
                }
              },
              "summary": "Mock verdict produced without calling a provider.",
              "verdict": {"action": "Approve", "reason": "Mock mode"}
            }
            """;

    @Override
    public ChatResponse doChat(ChatRequest request) {
        ResponseFormat format = request.responseFormat();
        boolean judge = format != null && format.jsonSchema() != null
                && JUDGE_SCHEMA_NAME.equals(format.jsonSchema().name());
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(judge ? JUDGE_VERDICT : VERDICT))
                .tokenUsage(new TokenUsage(INPUT_TOKENS, OUTPUT_TOKENS))
                .modelName(MODEL_NAME)
                .build();
    }
}
