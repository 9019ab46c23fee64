package com.eainde.slopstopper.config;

import com.eainde.slopstopper.analysis.AnalysisPass;
import com.eainde.slopstopper.ingest.HistoryIngestor;
import com.eainde.slopstopper.ingest.TakeoutHistoryReader;
import com.eainde.slopstopper.ingest.VideoIdExtractor;
import com.eainde.slopstopper.pricing.CostAccountant;
import com.eainde.slopstopper.provider.AnalysisRequestFactory;
import com.eainde.slopstopper.provider.GeminiChatModel;
import com.eainde.slopstopper.provider.MockAnalysisChatModel;
import com.eainde.slopstopper.provider.PersonaPrompts;
import com.eainde.slopstopper.provider.ProviderInvoker;
import com.eainde.slopstopper.provider.ProviderSettings;
import com.eainde.slopstopper.schema.AnalysisSchema;
import com.eainde.slopstopper.schema.AnalysisSchemaValidator;
import com.eainde.slopstopper.store.JdbcRecordStore;
import com.eainde.slopstopper.store.RecordStore;
import com.eainde.slopstopper.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Slf4j
@Configuration
public class PipelineConfig {

    // --- Store & ingestion ---

    @Bean
    public RecordStore recordStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        return new JdbcRecordStore(jdbcTemplate, transactionManager);
    }

    @Bean
    public VideoIdExtractor videoIdExtractor() {
        return new VideoIdExtractor();
    }

    @Bean
    public TakeoutHistoryReader takeoutHistoryReader(ObjectMapper objectMapper) {
        return new TakeoutHistoryReader(objectMapper);
    }

    @Bean
    public HistoryIngestor historyIngestor(
            RecordStore recordStore,
            VideoIdExtractor videoIdExtractor,
            @Value("${slopstopper.ingest.accepted-headers:YouTube}") List<String> acceptedHeaders) {
        return new HistoryIngestor(recordStore, videoIdExtractor, acceptedHeaders);
    }

    // --- Schema & pricing ---

    @Bean
    public AnalysisSchema analysisSchema(ObjectMapper objectMapper) {
        return AnalysisSchema.load(PersonaPrompts.AUDITOR_V1.schemaVersion(), objectMapper);
    }

    @Bean
    public AnalysisSchemaValidator analysisSchemaValidator(AnalysisSchema analysisSchema, ObjectMapper objectMapper) {
        return new AnalysisSchemaValidator(analysisSchema, objectMapper);
    }

    @Bean
    public CostAccountant costAccountant() {
        return new CostAccountant();
    }

    // --- Provider ---

    @Bean
    public ProviderSettings providerSettings(
            @Value("${slopstopper.provider.mode:gemini}") String mode,
            @Value("${slopstopper.provider.api-key:}") String apiKey,
            @Value("${slopstopper.provider.model:gemini-3-flash-preview}") String model,
            @Value("${slopstopper.provider.temperature:0.2}") Double temperature,
            @Value("${slopstopper.provider.timeout:120s}") Duration timeout,
            @Value("${slopstopper.provider.max-attempts:4}") int maxAttempts,
            @Value("${slopstopper.provider.initial-backoff:2s}") Duration initialBackoff) {
        return new ProviderSettings(mode, apiKey, model, temperature, timeout, maxAttempts, initialBackoff);
    }

    /**
     * Created on first use, so commands that never reach the provider run without an API key.
     */
    @Bean
    @Lazy
    public ChatModel analysisChatModel(ProviderSettings settings,
                                       @Value("${slopstopper.provider.log-requests:false}") boolean logRequests) {
        if (settings.isMock()) {
            log.info("Provider mode is mock; no requests leave this process");
            return new MockAnalysisChatModel();
        }
        return GeminiChatModel.builder()
                .apiKey(settings.apiKey())
                .modelName(settings.model())
                .temperature(settings.temperature())
                .timeout(settings.timeout())
                .logRequests(logRequests)
                .build();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("provider-call-");
        threadFactory.setDaemon(true);
        return new MdcAwareExecutor(Executors.newCachedThreadPool(threadFactory));
    }

    @Bean
    public ProviderInvoker providerInvoker(@Lazy ChatModel analysisChatModel,
                                           ExecutorService providerCallExecutor,
                                           ProviderSettings settings) {
        return new ProviderInvoker(analysisChatModel, providerCallExecutor, settings.timeout(),
                Math.max(1, settings.maxAttempts()), settings.initialBackoff());
    }

    @Bean
    public AnalysisRequestFactory analysisRequestFactory(AnalysisSchema analysisSchema, ProviderSettings settings) {
        return new AnalysisRequestFactory(PersonaPrompts.AUDITOR_V1, analysisSchema, settings.temperature());
    }

    @Bean
    public AnalysisPass analysisPass(AnalysisRequestFactory analysisRequestFactory,
                                     ProviderInvoker providerInvoker,
                                     AnalysisSchemaValidator analysisSchemaValidator) {
        return new AnalysisPass(analysisRequestFactory, providerInvoker, analysisSchemaValidator);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
