package com.eainde.slopstopper.schema;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Typed view of a validated verdict. Only built from payloads that already passed
 * {@link AnalysisSchemaValidator}; unknown fields are ignored here and kept in the raw payload.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VideoAnalysis(
        @JsonProperty("visual_grounding") VisualGrounding visualGrounding,
        @JsonProperty("video_metadata") VideoMetadata videoMetadata,
        @JsonProperty("content_taxonomy") ContentTaxonomy contentTaxonomy,
        @JsonProperty("narrative_quality") NarrativeQuality narrativeQuality,
        @JsonProperty("cognitive_nutrition") CognitiveNutrition cognitiveNutrition,
        @JsonProperty("risk_assessment") RiskAssessment riskAssessment,
        @JsonProperty("summary") String summary,
        @JsonProperty("verdict") Verdict verdict
) {

    /**
     * Null when the model omitted {@code video_metadata}.
     */
    public Boolean isShort() {
        return videoMetadata == null ? null : videoMetadata.format() == VideoFormat.SHORT_VERTICAL;
    }

    // --- Dimension 1: visual grounding ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VisualGrounding(
            @JsonProperty("detected_entities") List<String> detectedEntities,
            @JsonProperty("setting") String setting,
            @JsonProperty("text_on_screen") String textOnScreen) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VideoMetadata(
            @JsonProperty("format") VideoFormat format,
            @JsonProperty("duration_perceived") DurationPerceived durationPerceived) {
    }

    // --- Dimension 2: content taxonomy ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ContentTaxonomy(
            @JsonProperty("primary_genre") PrimaryGenre primaryGenre,
            @JsonProperty("specific_topic") String specificTopic,
            @JsonProperty("target_demographic") TargetDemographic targetDemographic) {
    }

    // --- Dimension 3: narrative quality ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record NarrativeQuality(
            @JsonProperty("structural_integrity") StructuralIntegrity structuralIntegrity,
            @JsonProperty("creative_intent") CreativeIntent creativeIntent,
            @JsonProperty("weirdness_verdict") WeirdnessVerdict weirdnessVerdict) {
    }

    // --- Dimension 4: cognitive nutrition ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CognitiveNutrition(
            @JsonProperty("intellectual_density") IntellectualDensity intellectualDensity,
            @JsonProperty("emotional_volatility") EmotionalVolatility emotionalVolatility,
            @JsonProperty("is_brainrot") boolean brainrot,
            @JsonProperty("is_slop") boolean slop) {
    }

    // --- Dimension 5: risk assessment ---

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RiskAssessment(
            @JsonProperty("safety_score") int safetyScore,
            @JsonProperty("flags") RiskFlags flags) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RiskFlags(
            @JsonProperty("ideological_radicalization") boolean ideologicalRadicalization,
            @JsonProperty("pseudoscience_misinfo") boolean pseudoscienceMisinfo,
            @JsonProperty("body_image_harm") boolean bodyImageHarm,
            @JsonProperty("dangerous_behavior") boolean dangerousBehavior,
            @JsonProperty("commercial_exploitation") boolean commercialExploitation,
            @JsonProperty("lootbox_gambling") boolean lootboxGambling,
            @JsonProperty("sexual_themes") boolean sexualThemes,
            @JsonProperty("mascot_horror") boolean mascotHorror) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Verdict(
            @JsonProperty("action") ActionVerdict action,
            @JsonProperty("reason") String reason) {
    }

    // --- Enumerations; wire values must match the schema resource ---

    public enum VideoFormat {
        STANDARD_LANDSCAPE("Standard_Landscape"),
        SHORT_VERTICAL("Short_Vertical"),
        LIVESTREAM_VOD("Livestream_VOD"),
        UNKNOWN("Unknown");

        private final String value;

        VideoFormat(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum DurationPerceived {
        MICRO("Micro (<1 min)"),
        SHORT("Short (1-5 min)"),
        MEDIUM("Medium (5-20 min)"),
        LONG("Long (20+ min)");

        private final String value;

        DurationPerceived(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum PrimaryGenre {
        GAMING_GAMEPLAY("Gaming_Gameplay"),
        GAMING_CULTURE("Gaming_Culture"),
        ANIMATION_STORYTIME("Animation_Storytime"),
        ANIMATION_CONTENTFARM("Animation_ContentFarm"),
        TOYS_UNBOXING("Toys_Unboxing"),
        PRANKS_CHALLENGES("Pranks_Challenges"),
        EDUCATION_STEM("Education_STEM"),
        EDUCATION_HUMANITIES("Education_Humanities"),
        MASCOT_HORROR("Mascot_Horror"),
        INTERNET_CULTURE("Internet_Culture"),
        VLOG_LIFESTYLE("Vlog_Lifestyle"),
        MUSIC_DANCE("Music_Dance"),
        PSEUDOSCIENCE_CONSPIRACY("Pseudoscience_Conspiracy"),
        OTHER("Other");

        private final String value;

        PrimaryGenre(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum TargetDemographic {
        TODDLER("Toddler (0-4)"),
        CHILD("Child (5-9)"),
        PRE_TEEN("Pre-Teen (10-12)"),
        TEEN("Teen (13+)"),
        ADULT("Adult");

        private final String value;

        TargetDemographic(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum StructuralIntegrity {
        COHERENT_NARRATIVE("Coherent_Narrative"),
        LOOSE_VLOG_STYLE("Loose_Vlog_Style"),
        COMPILATION_CLIPS("Compilation_Clips"),
        INCOHERENT_CHAOS("Incoherent_Chaos");

        private final String value;

        StructuralIntegrity(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum CreativeIntent {
        ARTISTIC_CREATIVE("Artistic/Creative"),
        INFORMATIONAL("Informational"),
        PARASOCIAL_VLOG("Parasocial/Vlog"),
        ALGORITHMIC_SLOP("Algorithmic/Slop");

        private final String value;

        CreativeIntent(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum WeirdnessVerdict {
        NORMAL("Normal"),
        CREATIVE_SURREALISM("Creative_Surrealism"),
        DISTURBING_UNCANNY("Disturbing_Uncanny"),
        LAZY_RANDOMNESS("Lazy_Randomness");

        private final String value;

        WeirdnessVerdict(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum IntellectualDensity {
        VOID("Void (Mindless)"),
        LOW("Low (Trivia)"),
        MEDIUM("Medium (Story/Hobby)"),
        HIGH("High (Educational)");

        private final String value;

        IntellectualDensity(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum EmotionalVolatility {
        CALM("Calm"),
        UPBEAT("Upbeat"),
        HIGH_STRESS("High_Stress"),
        AGGRESSIVE_SCREAMING("Aggressive_Screaming");

        private final String value;

        EmotionalVolatility(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    public enum ActionVerdict {
        APPROVE("Approve"),
        MONITOR("Monitor"),
        BLOCK_VIDEO("Block_Video"),
        BLOCK_CHANNEL("Block_Channel");

        private final String value;

        ActionVerdict(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }
}
