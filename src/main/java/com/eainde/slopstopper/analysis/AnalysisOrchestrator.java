package com.eainde.slopstopper.analysis;

import com.eainde.slopstopper.error.PipelineException;
import com.eainde.slopstopper.error.SchemaViolationException;
import com.eainde.slopstopper.error.TransportException;
import com.eainde.slopstopper.error.UnknownModelPricingException;
import com.eainde.slopstopper.pricing.CostAccountant;
import com.eainde.slopstopper.provider.ProviderSettings;
import com.eainde.slopstopper.store.AnalysisResult;
import com.eainde.slopstopper.store.Claim;
import com.eainde.slopstopper.store.RecordStore;
import com.eainde.slopstopper.store.VideoRecord;
import com.eainde.slopstopper.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Selects records, claims them and drives each through build, invoke, validate, account and persist.
 * <p>
 * Every transition is a conditional update in the {@link RecordStore}; nothing here locks in memory,
 * so several orchestrators (threads or processes) can run against one store. Per-record failures
 * become ERROR resolutions. Only a {@link com.eainde.slopstopper.error.FatalPreconditionException}
 * escapes {@link #run}, and it is thrown before anything is claimed.
 */
@Slf4j
@Service
public class AnalysisOrchestrator {

    public static final String MDC_VIDEO_ID = "videoId";
    static final int MAX_WORKERS = 20;

    private final RecordStore recordStore;
    private final AnalysisPass analysisPass;
    private final CostAccountant costAccountant;
    private final ProviderSettings providerSettings;
    private final Clock clock;
    private final int defaultWorkers;
    private final Duration staleClaimThreshold;

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private volatile Batch current;

    public AnalysisOrchestrator(RecordStore recordStore,
                                AnalysisPass analysisPass,
                                CostAccountant costAccountant,
                                ProviderSettings providerSettings,
                                Clock clock,
                                @Value("${slopstopper.orchestrator.workers:5}") int defaultWorkers,
                                @Value("${slopstopper.orchestrator.stale-claim-threshold:15m}") Duration staleClaimThreshold) {
        this.recordStore = recordStore;
        this.analysisPass = analysisPass;
        this.costAccountant = costAccountant;
        this.providerSettings = providerSettings;
        this.clock = clock;
        this.defaultWorkers = defaultWorkers;
        this.staleClaimThreshold = staleClaimThreshold;
    }

    public BatchSummary run(SelectionPolicy policy) {
        return run(policy, null);
    }

    /**
     * @param workers pool size for this batch, clamped to 1..20; {@code null} uses the configured default
     */
    public BatchSummary run(SelectionPolicy policy, Integer workers) {
        // fail before any claim is made
        providerSettings.verifyReady();
        String model = providerSettings.effectiveModel();
        if (!costAccountant.isPriced(model)) {
            log.warn("Model {} has no price entry; every record of this batch will resolve to ERROR", model);
        }
        cancelled.set(false);

        List<String> ids = select(policy);
        if (ids.isEmpty()) {
            log.info("Nothing to analyze for selection {}", policy);
            return BatchSummary.empty();
        }

        int poolSize = clampWorkers(workers != null ? workers : defaultWorkers);
        log.info("Starting analysis batch: selection={}, records={}, workers={}, model={}",
                policy, ids.size(), poolSize, model);

        MdcAwareExecutor pool = MdcAwareExecutor.fixed(poolSize, "analysis-");
        List<Future<RecordOutcome>> futures = new CopyOnWriteArrayList<>();
        Batch batch = new Batch(pool, futures);
        current = batch;
        try {
            for (String id : ids) {
                try {
                    futures.add(pool.submit(() -> process(id, model)));
                } catch (RejectedExecutionException e) {
                    // cancelled while submitting
                    futures.add(CompletableFuture.completedFuture(RecordOutcome.of(id, Resolution.CANCELLED)));
                }
            }
            pool.shutdown();

            List<RecordOutcome> outcomes = new ArrayList<>(ids.size());
            for (int i = 0; i < ids.size(); i++) {
                outcomes.add(await(ids.get(i), futures.get(i)));
            }

            BatchSummary summary = BatchSummary.aggregate(outcomes);
            log.info("Analysis batch finished: {}", summary);
            return summary;
        } finally {
            pool.shutdownNow();
            current = null;
        }
    }

    /**
     * Operator interrupt. Running records are interrupted and stay IN_PROGRESS until the
     * staleness sweep reclaims them; records not yet started are never claimed.
     */
    public void cancel() {
        cancelled.set(true);
        Batch batch = current;
        if (batch != null) {
            log.warn("Cancelling analysis batch");
            batch.pool().shutdownNow();
            batch.futures().forEach(f -> f.cancel(true));
        }
    }

    List<String> select(SelectionPolicy policy) {
        Instant staleBefore = clock.instant().minus(staleClaimThreshold);
        return switch (policy.mode()) {
            case IDS -> policy.ids();
            case LIMIT -> recordStore.findClaimable(staleBefore, policy.limit());
            case ALL -> recordStore.findClaimable(staleBefore, null);
        };
    }

    RecordOutcome process(String videoId, String model) {
        MDC.put(MDC_VIDEO_ID, videoId);
        try {
            if (cancelled.get()) {
                return RecordOutcome.of(videoId, Resolution.CANCELLED);
            }
            Instant now = clock.instant();
            Optional<Claim> claim = recordStore.claim(videoId, now, now.minus(staleClaimThreshold));
            if (claim.isEmpty()) {
                boolean exists = recordStore.findById(videoId).isPresent();
                log.info("Record {} {}", videoId, exists ? "is not claimable" : "does not exist");
                return RecordOutcome.of(videoId, exists ? Resolution.NOT_CLAIMED : Resolution.NOT_FOUND);
            }
            return analyze(claim.get(), model);
        } finally {
            MDC.remove(MDC_VIDEO_ID);
        }
    }

    private RecordOutcome analyze(Claim claim, String model) {
        String videoId = claim.videoId();
        try {
            VideoRecord record = recordStore.findById(videoId)
                    .orElseThrow(() -> new IllegalStateException("claimed record vanished: " + videoId));

            PassResult pass = analysisPass.run(record, model);
            BigDecimal cost = costAccountant.estimate(pass.modelUsed(), pass.inputTokens(), pass.outputTokens());

            AnalysisResult result = new AnalysisResult(
                    pass.verdict().payloadJson(),
                    pass.verdict().safetyScore(),
                    pass.verdict().primaryGenre(),
                    pass.verdict().slop(),
                    pass.verdict().brainrot(),
                    pass.verdict().analysis().isShort(),
                    pass.verdict().verdictAction(),
                    pass.modelUsed(),
                    pass.verdict().schemaVersion(),
                    pass.inputTokens(),
                    pass.outputTokens(),
                    cost);

            if (!recordStore.markAnalyzed(claim, result, clock.instant())) {
                log.warn("Claim on {} was lost before the verdict could be stored", videoId);
                return RecordOutcome.of(videoId, Resolution.CLAIM_LOST, pass.modelUsed(), "claim lost");
            }
            log.info("Analyzed {}: safetyScore={}, genre={}, cost={}",
                    videoId, result.safetyScore(), result.primaryGenre(), cost.toPlainString());
            return RecordOutcome.analyzed(videoId, pass, cost);

        } catch (TransportException e) {
            return fail(claim, Resolution.TRANSPORT_ERROR, e, model);
        } catch (SchemaViolationException e) {
            return fail(claim, Resolution.SCHEMA_VIOLATION, e, model);
        } catch (UnknownModelPricingException e) {
            return fail(claim, Resolution.UNKNOWN_MODEL_PRICING, e, model);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Analysis of {} interrupted; record stays IN_PROGRESS for the staleness sweep", videoId);
            return RecordOutcome.of(videoId, Resolution.CANCELLED, model, null);
        } catch (RuntimeException e) {
            log.error("Unexpected failure analyzing {}", videoId, e);
            String detail = "Unexpected: " + e.getClass().getSimpleName() + ": " + e.getMessage();
            return resolveError(claim, Resolution.UNEXPECTED_ERROR, detail, model);
        }
    }

    private RecordOutcome fail(Claim claim, Resolution resolution, PipelineException e, String model) {
        log.warn("Analysis of {} failed: {}", claim.videoId(), e.toErrorDetail());
        return resolveError(claim, resolution, e.toErrorDetail(), model);
    }

    private RecordOutcome resolveError(Claim claim, Resolution resolution, String detail, String model) {
        try {
            if (!recordStore.markError(claim, detail, model)) {
                log.warn("Claim on {} was lost before the error could be stored", claim.videoId());
                return RecordOutcome.of(claim.videoId(), Resolution.CLAIM_LOST, model, detail);
            }
        } catch (RuntimeException storeFailure) {
            // the claim goes stale and is swept by a later run
            log.error("Could not record error for {}", claim.videoId(), storeFailure);
        }
        return RecordOutcome.of(claim.videoId(), resolution, model, detail);
    }

    private RecordOutcome await(String videoId, Future<RecordOutcome> future) {
        try {
            return future.get();
        } catch (CancellationException e) {
            return RecordOutcome.of(videoId, Resolution.CANCELLED);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return RecordOutcome.of(videoId, Resolution.CANCELLED);
        } catch (ExecutionException e) {
            log.error("Worker for {} died", videoId, e.getCause());
            return RecordOutcome.of(videoId, Resolution.UNEXPECTED_ERROR, null, String.valueOf(e.getCause()));
        }
    }

    static int clampWorkers(int requested) {
        return Math.max(1, Math.min(MAX_WORKERS, requested));
    }

    private record Batch(MdcAwareExecutor pool, List<Future<RecordOutcome>> futures) {
    }
}
