package com.eainde.slopstopper.analysis;

import com.eainde.slopstopper.error.FatalPreconditionException;
import com.eainde.slopstopper.error.TransportException;
import com.eainde.slopstopper.ingest.HistoryEntry;
import com.eainde.slopstopper.ingest.HistoryIngestor;
import com.eainde.slopstopper.ingest.IngestionReport;
import com.eainde.slopstopper.ingest.VideoIdExtractor;
import com.eainde.slopstopper.pricing.CostAccountant;
import com.eainde.slopstopper.provider.AnalysisRequestFactory;
import com.eainde.slopstopper.provider.PersonaPrompts;
import com.eainde.slopstopper.provider.ProviderInvoker;
import com.eainde.slopstopper.provider.ProviderSettings;
import com.eainde.slopstopper.schema.AnalysisSchema;
import com.eainde.slopstopper.schema.AnalysisSchemaValidator;
import com.eainde.slopstopper.store.JdbcRecordStore;
import com.eainde.slopstopper.store.RecordStatus;
import com.eainde.slopstopper.store.VideoRecord;
import com.eainde.slopstopper.support.Fixtures;
import com.eainde.slopstopper.support.ScriptedChatModel;
import com.eainde.slopstopper.support.TestDatabase;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisOrchestratorTest {

    private static final Instant NOW = Instant.parse("2025-02-01T09:00:00Z");
    private static final String MODEL = "gemini-2.5-flash";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final AnalysisSchema SCHEMA = AnalysisSchema.load(AnalysisSchema.V1, MAPPER);

    private JdbcRecordStore store;
    private HistoryIngestor ingestor;
    private ExecutorService callExecutor;

    @BeforeEach
    void setUp() {
        store = new TestDatabase().recordStore();
        ingestor = new HistoryIngestor(store, new VideoIdExtractor(), List.of("YouTube"));
        callExecutor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        callExecutor.shutdownNow();
    }

    private static ProviderSettings settings(String mode, String apiKey, String model) {
        return new ProviderSettings(mode, apiKey, model, 0.2, Duration.ofSeconds(5), 2, Duration.ofMillis(1));
    }

    private AnalysisOrchestrator orchestrator(ChatModel chatModel, ProviderSettings settings) {
        ProviderInvoker invoker = new ProviderInvoker(chatModel, callExecutor, settings.timeout(),
                settings.maxAttempts(), settings.initialBackoff());
        AnalysisPass pass = new AnalysisPass(
                new AnalysisRequestFactory(PersonaPrompts.AUDITOR_V1, SCHEMA, settings.temperature()),
                invoker,
                new AnalysisSchemaValidator(SCHEMA, MAPPER));
        return new AnalysisOrchestrator(store, pass, new CostAccountant(), settings,
                Clock.fixed(NOW, ZoneOffset.UTC), 5, Duration.ofMinutes(15));
    }

    private AnalysisOrchestrator orchestrator(ChatModel chatModel) {
        return orchestrator(chatModel, settings(ProviderSettings.MODE_GEMINI, "test-key", MODEL));
    }

    private static HistoryEntry watched(String id, Instant watchedAt) {
        return new HistoryEntry("YouTube", "Watched video " + id, "https://www.youtube.com/watch?v=" + id,
                "Channel " + id, null, watchedAt, watchedAt.toString());
    }

    private void ingest(String... ids) {
        List<HistoryEntry> entries = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            entries.add(watched(ids[i], NOW.minus(Duration.ofHours(i + 1))));
        }
        ingestor.ingest(entries);
    }

    private VideoRecord record(String id) {
        return store.findById(id).orElseThrow();
    }

    @Nested
    @DisplayName("end to end")
    class EndToEnd {

        @Test
        void shouldIngestThenAnalyzeLimitedBatch() {
            // GIVEN two valid entries and one without a video id
            IngestionReport report = ingestor.ingest(List.of(
                    watched("aaaaaaaaaaa", NOW.minus(Duration.ofHours(1))),
                    watched("bbbbbbbbbbb", NOW.minus(Duration.ofHours(2))),
                    new HistoryEntry("YouTube", "A community post", "https://www.youtube.com/post/Ugkx123",
                            null, null, NOW, NOW.toString())));
            assertThat(report.inserted()).isEqualTo(2);
            assertThat(report.skipped()).isEqualTo(1);
            assertThat(store.countByStatus())
                    .containsEntry(RecordStatus.PENDING, 2)
                    .containsEntry(RecordStatus.SKIPPED, 1);

            ScriptedChatModel chatModel = ScriptedChatModel.answering(Fixtures.validVerdict(), MODEL);

            // WHEN
            BatchSummary summary = orchestrator(chatModel).run(SelectionPolicy.limit(2));

            // THEN
            assertThat(summary.getTotalCount()).isEqualTo(2);
            assertThat(summary.count(Resolution.ANALYZED)).isEqualTo(2);
            assertThat(summary.getTotalInputTokens()).isEqualTo(2000);
            assertThat(summary.getTotalCost()).isEqualByComparingTo("0.0031");

            VideoRecord analyzed = record("aaaaaaaaaaa");
            assertThat(analyzed.status()).isEqualTo(RecordStatus.ANALYZED);
            assertThat(analyzed.analysisPayload()).contains("Gaming_Gameplay");
            assertThat(analyzed.safetyScore()).isEqualTo(35);
            assertThat(analyzed.primaryGenre()).isEqualTo("Gaming_Gameplay");
            assertThat(analyzed.slop()).isTrue();
            assertThat(analyzed.isShort()).isTrue();
            assertThat(analyzed.modelUsed()).isEqualTo(MODEL);
            assertThat(analyzed.schemaVersion()).isEqualTo(AnalysisSchema.V1);
            assertThat(analyzed.inputTokens()).isEqualTo(1000);
            assertThat(analyzed.outputTokens()).isEqualTo(500);
            assertThat(analyzed.estimatedCost()).isEqualByComparingTo(new BigDecimal("0.00155"));
            assertThat(analyzed.analyzedAt()).isEqualTo(NOW);
            assertThat(analyzed.claimedAt()).isNull();

            assertThat(store.countByStatus()).containsEntry(RecordStatus.SKIPPED, 1);
        }

        @Test
        void shouldAnalyzeEveryRecordExactlyOnceWithManyWorkers() {
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 12; i++) {
                ids.add(String.format("vid%08d", i));
            }
            ingest(ids.toArray(new String[0]));
            ScriptedChatModel chatModel = ScriptedChatModel.answering(Fixtures.validVerdict(), MODEL);

            BatchSummary summary = orchestrator(chatModel).run(SelectionPolicy.all(), 4);

            assertThat(summary.count(Resolution.ANALYZED)).isEqualTo(12);
            assertThat(chatModel.requests()).hasSize(12);
            assertThat(store.countByStatus()).containsEntry(RecordStatus.ANALYZED, 12);
        }

        @Test
        void shouldReturnEmptySummaryWhenNothingIsClaimable() {
            BatchSummary summary = orchestrator(ScriptedChatModel.answering("{}", MODEL)).run(SelectionPolicy.all());

            assertThat(summary.getTotalCount()).isZero();
            assertThat(summary.getTotalCost()).isEqualByComparingTo(BigDecimal.ZERO);
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        void shouldRecordSchemaViolationAndContinueWithOtherRecords() {
            ingest("aaaaaaaaaaa", "bbbbbbbbbbb");
            String outOfRange = Fixtures.validVerdict().replace("\"safety_score\": 35", "\"safety_score\": 150");
            ScriptedChatModel chatModel = ScriptedChatModel.answering(Fixtures.validVerdict(), MODEL)
                    .when("bbbbbbbbbbb", request -> ScriptedChatModel.response(outOfRange, MODEL));

            BatchSummary summary = orchestrator(chatModel).run(SelectionPolicy.all());

            assertThat(summary.count(Resolution.ANALYZED)).isEqualTo(1);
            assertThat(summary.count(Resolution.SCHEMA_VIOLATION)).isEqualTo(1);
            assertThat(summary.getErrorCount()).isEqualTo(1);

            VideoRecord failed = record("bbbbbbbbbbb");
            assertThat(failed.status()).isEqualTo(RecordStatus.ERROR);
            assertThat(failed.errorDetail())
                    .startsWith("SchemaViolation: ")
                    .contains("risk_assessment.safety_score");
            assertThat(failed.analysisPayload()).isNull();
            assertThat(failed.modelUsed()).isEqualTo(MODEL);
            // no retry for malformed output
            assertThat(chatModel.requests()).hasSize(2);
        }

        @Test
        void shouldRecordTransportErrorAfterRetriesAreExhausted() {
            ingest("aaaaaaaaaaa");
            ScriptedChatModel chatModel = new ScriptedChatModel(request -> {
                throw new TransportException("Gemini returned 503: overloaded", true);
            });

            BatchSummary summary = orchestrator(chatModel).run(SelectionPolicy.all());

            assertThat(summary.count(Resolution.TRANSPORT_ERROR)).isEqualTo(1);
            assertThat(chatModel.requests()).hasSize(2);
            VideoRecord failed = record("aaaaaaaaaaa");
            assertThat(failed.status()).isEqualTo(RecordStatus.ERROR);
            assertThat(failed.errorDetail()).startsWith("TransportError: gave up after 2 attempts");
        }

        @Test
        void shouldRecordUnknownModelPricing() {
            ingest("aaaaaaaaaaa");
            ScriptedChatModel chatModel = ScriptedChatModel.answering(Fixtures.validVerdict(), "gemini-9-ultra");

            BatchSummary summary = orchestrator(chatModel, settings(ProviderSettings.MODE_GEMINI, "k", "gemini-9-ultra"))
                    .run(SelectionPolicy.all());

            assertThat(summary.count(Resolution.UNKNOWN_MODEL_PRICING)).isEqualTo(1);
            VideoRecord failed = record("aaaaaaaaaaa");
            assertThat(failed.status()).isEqualTo(RecordStatus.ERROR);
            assertThat(failed.errorDetail()).startsWith("UnknownModelPricing: ").contains("gemini-9-ultra");
            assertThat(failed.analysisPayload()).isNull();
        }

        @Test
        void shouldRecordUnexpectedFailure() {
            ingest("aaaaaaaaaaa");
            ScriptedChatModel chatModel = new ScriptedChatModel(request -> {
                throw new IllegalStateException("boom");
            });

            BatchSummary summary = orchestrator(chatModel).run(SelectionPolicy.all());

            assertThat(summary.count(Resolution.UNEXPECTED_ERROR)).isEqualTo(1);
            VideoRecord failed = record("aaaaaaaaaaa");
            assertThat(failed.status()).isEqualTo(RecordStatus.ERROR);
            assertThat(failed.errorDetail()).isEqualTo("Unexpected: IllegalStateException: boom");
        }

        @Test
        void shouldFailFastWithoutClaimingWhenApiKeyIsMissing() {
            ingest("aaaaaaaaaaa", "bbbbbbbbbbb");
            ScriptedChatModel chatModel = ScriptedChatModel.answering(Fixtures.validVerdict(), MODEL);
            AnalysisOrchestrator orchestrator = orchestrator(chatModel, settings(ProviderSettings.MODE_GEMINI, " ", MODEL));

            assertThatThrownBy(() -> orchestrator.run(SelectionPolicy.all()))
                    .isInstanceOf(FatalPreconditionException.class)
                    .hasMessageContaining("GEMINI_API_KEY");

            assertThat(chatModel.requests()).isEmpty();
            assertThat(store.countByStatus())
                    .containsEntry(RecordStatus.PENDING, 2)
                    .containsEntry(RecordStatus.IN_PROGRESS, 0);
        }
    }

    @Nested
    @DisplayName("selection and claims")
    class Selection {

        @Test
        void shouldReportNotClaimedAndNotFoundForExplicitIds() {
            ingest("aaaaaaaaaaa", "bbbbbbbbbbb");
            ScriptedChatModel chatModel = ScriptedChatModel.answering(Fixtures.validVerdict(), MODEL);
            AnalysisOrchestrator orchestrator = orchestrator(chatModel);
            orchestrator.run(SelectionPolicy.ids(List.of("aaaaaaaaaaa")));

            BatchSummary summary = orchestrator.run(
                    SelectionPolicy.ids(List.of("aaaaaaaaaaa", "bbbbbbbbbbb", "zzzzzzzzzzz")));

            assertThat(summary.count(Resolution.NOT_CLAIMED)).isEqualTo(1);
            assertThat(summary.count(Resolution.ANALYZED)).isEqualTo(1);
            assertThat(summary.count(Resolution.NOT_FOUND)).isEqualTo(1);
            assertThat(chatModel.requests()).hasSize(2);
        }

        @Test
        void shouldReclaimStaleClaimsButLeaveFreshOnes() {
            ingest("aaaaaaaaaaa", "bbbbbbbbbbb");
            Instant staleAt = NOW.minus(Duration.ofMinutes(20));
            Instant freshAt = NOW.minus(Duration.ofMinutes(5));
            assertThat(store.claim("aaaaaaaaaaa", staleAt, staleAt.minus(Duration.ofMinutes(15)))).isPresent();
            assertThat(store.claim("bbbbbbbbbbb", freshAt, freshAt.minus(Duration.ofMinutes(15)))).isPresent();
            ScriptedChatModel chatModel = ScriptedChatModel.answering(Fixtures.validVerdict(), MODEL);

            BatchSummary summary = orchestrator(chatModel).run(SelectionPolicy.all());

            assertThat(summary.getTotalCount()).isEqualTo(1);
            assertThat(record("aaaaaaaaaaa").status()).isEqualTo(RecordStatus.ANALYZED);
            assertThat(record("bbbbbbbbbbb").status()).isEqualTo(RecordStatus.IN_PROGRESS);
        }

        @Test
        void shouldAnalyzeMostRecentlyWatchedFirstWhenLimited() {
            ingest("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc");

            orchestrator(ScriptedChatModel.answering(Fixtures.validVerdict(), MODEL)).run(SelectionPolicy.limit(1));

            assertThat(record("aaaaaaaaaaa").status()).isEqualTo(RecordStatus.ANALYZED);
            assertThat(record("bbbbbbbbbbb").status()).isEqualTo(RecordStatus.PENDING);
            assertThat(record("ccccccccccc").status()).isEqualTo(RecordStatus.PENDING);
        }

        @Test
        void shouldClampWorkerCount() {
            assertThat(AnalysisOrchestrator.clampWorkers(0)).isEqualTo(1);
            assertThat(AnalysisOrchestrator.clampWorkers(-3)).isEqualTo(1);
            assertThat(AnalysisOrchestrator.clampWorkers(7)).isEqualTo(7);
            assertThat(AnalysisOrchestrator.clampWorkers(500)).isEqualTo(20);
        }

        @Test
        void shouldRejectInvalidSelection() {
            assertThatThrownBy(() -> SelectionPolicy.limit(0)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> SelectionPolicy.ids(List.of())).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("cancellation")
    class Cancellation {

        @Test
        void shouldLeaveRunningRecordReclaimableAndNeverClaimUnstartedOnes() throws Exception {
            // GIVEN one worker stuck in a provider call for the first of three records
            ingest("aaaaaaaaaaa", "bbbbbbbbbbb", "ccccccccccc");
            CountDownLatch callStarted = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ScriptedChatModel chatModel = new ScriptedChatModel(request -> {
                callStarted.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ScriptedChatModel.response(Fixtures.validVerdict(), MODEL);
            });
            AnalysisOrchestrator orchestrator = orchestrator(chatModel);
            CompletableFuture<BatchSummary> running =
                    CompletableFuture.supplyAsync(() -> orchestrator.run(SelectionPolicy.all(), 1));
            assertThat(callStarted.await(5, TimeUnit.SECONDS)).isTrue();

            // WHEN
            orchestrator.cancel();
            BatchSummary summary = running.get(5, TimeUnit.SECONDS);
            release.countDown();

            // THEN
            assertThat(summary.getTotalCount()).isEqualTo(3);
            assertThat(summary.count(Resolution.CANCELLED)).isEqualTo(3);
            assertThat(chatModel.requests()).hasSize(1);

            VideoRecord interrupted = record("aaaaaaaaaaa");
            assertThat(interrupted.status()).isEqualTo(RecordStatus.IN_PROGRESS);
            assertThat(interrupted.claimedAt()).isEqualTo(NOW);
            assertThat(record("bbbbbbbbbbb").status()).isEqualTo(RecordStatus.PENDING);
            assertThat(record("bbbbbbbbbbb").claimedAt()).isNull();
            assertThat(record("ccccccccccc").status()).isEqualTo(RecordStatus.PENDING);
            assertThat(store.countByStatus()).containsEntry(RecordStatus.IN_PROGRESS, 1);
        }
    }
}
