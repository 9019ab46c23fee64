package com.eainde.slopstopper.compare;

import com.eainde.slopstopper.analysis.AnalysisPass;
import com.eainde.slopstopper.analysis.PassResult;
import com.eainde.slopstopper.error.FatalPreconditionException;
import com.eainde.slopstopper.error.PipelineException;
import com.eainde.slopstopper.error.SchemaViolationException;
import com.eainde.slopstopper.error.TransportException;
import com.eainde.slopstopper.pricing.CostAccountant;
import com.eainde.slopstopper.provider.ProviderInvoker;
import com.eainde.slopstopper.provider.ProviderSettings;
import com.eainde.slopstopper.store.RecordStore;
import com.eainde.slopstopper.store.VideoRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * A/B judge mode: two independent analysis passes over one record under different models,
 * then a judge pass that reconciles them.
 * <p>
 * Read-only with respect to the record store; the record's status, verdict and provenance
 * are never touched.
 */
@Slf4j
@Service
public class ModelComparator {

    private final RecordStore recordStore;
    private final AnalysisPass analysisPass;
    private final ProviderInvoker invoker;
    private final CostAccountant costAccountant;
    private final ProviderSettings providerSettings;
    private final ObjectMapper objectMapper;
    private final String defaultModelA;
    private final String defaultModelB;
    private final String judgeModel;
    private final String judgeFallbackModel;

    public ModelComparator(RecordStore recordStore,
                           AnalysisPass analysisPass,
                           ProviderInvoker invoker,
                           CostAccountant costAccountant,
                           ProviderSettings providerSettings,
                           ObjectMapper objectMapper,
                           @Value("${slopstopper.compare.model-a:gemini-2.5-flash-lite}") String defaultModelA,
                           @Value("${slopstopper.compare.model-b:gemini-3-flash-preview}") String defaultModelB,
                           @Value("${slopstopper.compare.judge-model:gemini-3-pro-preview}") String judgeModel,
                           @Value("${slopstopper.compare.judge-fallback-model:gemini-2.5-pro}") String judgeFallbackModel) {
        this.recordStore = recordStore;
        this.analysisPass = analysisPass;
        this.invoker = invoker;
        this.costAccountant = costAccountant;
        this.providerSettings = providerSettings;
        this.objectMapper = objectMapper;
        this.defaultModelA = defaultModelA;
        this.defaultModelB = defaultModelB;
        this.judgeModel = judgeModel;
        this.judgeFallbackModel = judgeFallbackModel;
    }

    public ComparisonReport compare(String videoId) throws InterruptedException {
        return compare(videoId, null, null);
    }

    /**
     * @param modelA {@code null} for the configured default
     * @param modelB {@code null} for the configured default
     * @throws FatalPreconditionException when the provider is not usable or the record does not exist
     */
    public ComparisonReport compare(String videoId, String modelA, String modelB) throws InterruptedException {
        providerSettings.verifyReady();
        VideoRecord record = recordStore.findById(videoId)
                .orElseThrow(() -> new FatalPreconditionException("no record with id '" + videoId + "'"));

        String resolvedA = modelA != null ? modelA : defaultModelA;
        String resolvedB = modelB != null ? modelB : defaultModelB;
        log.info("Comparing {} on {} (A) and {} (B)", videoId, resolvedA, resolvedB);

        ComparisonReport.Side a = runSide("A", record, resolvedA);
        ComparisonReport.Side b = runSide("B", record, resolvedB);

        if (!a.succeeded() || !b.succeeded()) {
            String reason = !a.succeeded() && !b.succeeded()
                    ? "both passes failed"
                    : (a.succeeded() ? "B" : "A") + " failed, nothing to reconcile";
            return new ComparisonReport(videoId, record.title(), a, b, null, reason);
        }

        try {
            JudgeVerdict verdict = judge(record, a.pass(), b.pass());
            log.info("Judge picked {} for {}: {}", verdict.winner(), videoId, verdict.reasoning());
            return new ComparisonReport(videoId, record.title(), a, b, verdict, null);
        } catch (PipelineException e) {
            log.warn("Judge pass failed for {}: {}", videoId, e.toErrorDetail());
            return new ComparisonReport(videoId, record.title(), a, b, null, e.toErrorDetail());
        }
    }

    private ComparisonReport.Side runSide(String label, VideoRecord record, String model) throws InterruptedException {
        try {
            PassResult pass = analysisPass.run(record, model);
            BigDecimal cost = costAccountant.isPriced(pass.modelUsed())
                    ? costAccountant.estimate(pass.modelUsed(), pass.inputTokens(), pass.outputTokens())
                    : null;
            return new ComparisonReport.Side(label, model, pass, cost, null);
        } catch (TransportException | SchemaViolationException e) {
            log.warn("Pass {} ({}) failed: {}", label, model, e.toErrorDetail());
            return new ComparisonReport.Side(label, model, null, null, e.toErrorDetail());
        }
    }

    JudgeVerdict judge(VideoRecord record, PassResult a, PassResult b) throws InterruptedException {
        String prompt = """
                Title: %s
                Channel: %s
                URL: %s

                ### Verdict A (%s)
                %s

                ### Verdict B (%s)
                %s
                """.formatted(record.title(), record.channelName(), record.url(),
                a.modelUsed(), a.verdict().payloadJson(),
                b.modelUsed(), b.verdict().payloadJson());

        ChatResponse response;
        try {
            response = invoker.invoke(judgeRequest(prompt, judgeModel));
        } catch (TransportException e) {
            log.warn("Judge model {} failed ({}), falling back to {}", judgeModel, e.getMessage(), judgeFallbackModel);
            response = invoker.invoke(judgeRequest(prompt, judgeFallbackModel));
        }
        return parseJudgeVerdict(response);
    }

    private ChatRequest judgeRequest(String prompt, String model) {
        return ChatRequest.builder()
                .messages(SystemMessage.from(JudgePrompts.SYSTEM), UserMessage.from(prompt))
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(JudgePrompts.RESPONSE_SCHEMA)
                        .build())
                .modelName(model)
                .build();
    }

    JudgeVerdict parseJudgeVerdict(ChatResponse response) {
        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        if (text == null || text.isBlank()) {
            throw new SchemaViolationException("$", "empty judge response");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(text.trim());
        } catch (JsonProcessingException e) {
            throw new SchemaViolationException("$", "judge response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        String winnerText = node.path("winner").asText(null);
        JudgeVerdict.Winner winner;
        try {
            winner = JudgeVerdict.Winner.valueOf(String.valueOf(winnerText));
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException("winner", "value '" + winnerText + "' is not one of [A, B, TIE]");
        }
        String reasoning = node.path("reasoning").asText(null);
        if (reasoning == null) {
            throw new SchemaViolationException("reasoning", "is required but missing");
        }
        String reconciledAction = node.hasNonNull("reconciled_action") ? node.get("reconciled_action").asText() : null;
        if (reconciledAction != null && !JudgePrompts.RECONCILED_ACTIONS.contains(reconciledAction)) {
            throw new SchemaViolationException("reconciled_action",
                    "value '" + reconciledAction + "' is not one of " + JudgePrompts.RECONCILED_ACTIONS);
        }

        TokenUsage usage = response.tokenUsage();
        return new JudgeVerdict(winner, reasoning, reconciledAction, response.modelName(),
                usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0,
                usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0);
    }
}
