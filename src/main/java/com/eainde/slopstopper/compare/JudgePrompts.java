package com.eainde.slopstopper.compare;

import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;

import java.util.List;

import static com.eainde.slopstopper.provider.MockAnalysisChatModel.JUDGE_SCHEMA_NAME;

final class JudgePrompts {

    static final String SYSTEM = """
            You are an impartial reviewer reconciling two independent audits of the same YouTube video.

            ### Inputs
            1. **Verdict A** and **Verdict B**: JSON objects produced by two different models for the
               same video, following the same schema.
            2. The video's title, channel and URL.

            ### Task
            - Compare the two verdicts dimension by dimension: grounding, taxonomy, narrative quality,
              cognitive nutrition and risk.
            - Decide which verdict is better supported by the evidence it cites. Prefer the verdict whose
              visual grounding actually justifies its classifications.
            - If neither is clearly better, answer TIE.
            - Give the action you would take for this video.

            ### Output Requirements
            A single JSON object with:
            - `winner`: "A", "B" or "TIE".
            - `reasoning`: a few sentences naming the decisive differences.
            - `reconciled_action`: "Approve", "Monitor", "Block_Video" or "Block_Channel".

            ### Important Constraints
            - Do not invent facts about the video that neither verdict mentions.
            - Do not favour a verdict because it is longer.
            """;

    static final List<String> RECONCILED_ACTIONS = List.of("Approve", "Monitor", "Block_Video", "Block_Channel");

    static final JsonSchema RESPONSE_SCHEMA = JsonSchema.builder()
            .name(JUDGE_SCHEMA_NAME)
            .rootElement(JsonObjectSchema.builder()
                    .addEnumProperty("winner", List.of("A", "B", "TIE"))
                    .addStringProperty("reasoning")
                    .addEnumProperty("reconciled_action", RECONCILED_ACTIONS)
                    .required("winner", "reasoning")
                    .build())
            .build();

    private JudgePrompts() {
    }
}
