package com.eainde.slopstopper.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Provider output that satisfied the schema: the typed view plus the full payload, extra fields included.
 *
 * @param payloadJson compact JSON written to the store as {@code analysis_json}
 */
public record ValidatedVerdict(String schemaVersion, VideoAnalysis analysis, JsonNode payload, String payloadJson) {

    public int safetyScore() {
        return analysis.riskAssessment().safetyScore();
    }

    public String primaryGenre() {
        return analysis.contentTaxonomy().primaryGenre().value();
    }

    public boolean slop() {
        return analysis.cognitiveNutrition().slop();
    }

    public boolean brainrot() {
        return analysis.cognitiveNutrition().brainrot();
    }

    public String verdictAction() {
        return analysis.verdict() == null ? null : analysis.verdict().action().value();
    }
}
