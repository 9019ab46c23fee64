package com.eainde.slopstopper.analysis;

import com.eainde.slopstopper.provider.AnalysisRequestFactory;
import com.eainde.slopstopper.provider.ProviderInvoker;
import com.eainde.slopstopper.schema.AnalysisSchemaValidator;
import com.eainde.slopstopper.schema.ValidatedVerdict;
import com.eainde.slopstopper.store.VideoRecord;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Build request, invoke provider, validate. Touches no record state, so the orchestrator
 * and the comparator share it.
 */
@Slf4j
public class AnalysisPass {

    private final AnalysisRequestFactory requestFactory;
    private final ProviderInvoker invoker;
    private final AnalysisSchemaValidator validator;

    public AnalysisPass(AnalysisRequestFactory requestFactory, ProviderInvoker invoker,
                        AnalysisSchemaValidator validator) {
        this.requestFactory = requestFactory;
        this.invoker = invoker;
        this.validator = validator;
    }

    /**
     * @throws com.eainde.slopstopper.error.TransportException       retries exhausted or non-retryable failure
     * @throws com.eainde.slopstopper.error.SchemaViolationException provider answered outside the contract
     */
    public PassResult run(VideoRecord record, String model) throws InterruptedException {
        ChatRequest request = requestFactory.build(record, model);
        ChatResponse response = invoker.invoke(request);

        String text = response.aiMessage() != null ? response.aiMessage().text() : null;
        String modelUsed = response.modelName() != null ? response.modelName() : model;
        TokenUsage usage = response.tokenUsage();
        int inputTokens = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
        int outputTokens = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        log.debug("Provider answered: model={}, inputTokens={}, outputTokens={}", modelUsed, inputTokens, outputTokens);

        ValidatedVerdict verdict = validator.validate(text);
        return new PassResult(modelUsed, verdict, inputTokens, outputTokens);
    }
}
