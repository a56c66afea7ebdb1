package com.editguard.orchestrator;

import com.editguard.communication.EventBus;
import com.editguard.config.PipelineSettings;
import com.editguard.core.PipelineException;
import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.confidence.ConfidenceEngine;
import com.editguard.core.event.EventType;
import com.editguard.core.execution.AdaptiveExecutionEngine;
import com.editguard.core.execution.ExecutionResult;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.impact.ImpactAnalyzer;
import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeRequest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * ReasoningOrchestrator: top-level entry point for one UI edit.
 *
 * Stage flow:  ANALYZE → ASSESS → EXECUTE → SUMMARIZE
 *
 * Fatal stage errors (PipelineException or any runtime exception) are caught
 * here, published as PIPELINE_FAILED, and returned as a failed ReasoningResult.
 * They are never retried. Validation failures are not fatal: they come back
 * as a completed result with success=false.
 *
 * One JSON outcome line is logged per run under the [Outcome] prefix.
 */
@Component
public class ReasoningOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReasoningOrchestrator.class);

    private static final String SOURCE = "ReasoningOrchestrator";

    private final ImpactAnalyzer          impactAnalyzer;
    private final ConfidenceEngine        confidenceEngine;
    private final AdaptiveExecutionEngine executionEngine;
    private final ExecutionSummaryWriter  summaryWriter;
    private final PreviewAdvisor          previewAdvisor;
    private final EventBus                eventBus;
    private final PipelineSettings        settings;
    private final ObjectMapper            objectMapper;

    public ReasoningOrchestrator(
            ImpactAnalyzer          impactAnalyzer,
            ConfidenceEngine        confidenceEngine,
            AdaptiveExecutionEngine executionEngine,
            ExecutionSummaryWriter  summaryWriter,
            PreviewAdvisor          previewAdvisor,
            EventBus                eventBus,
            PipelineSettings        settings,
            ObjectMapper            objectMapper
    ) {
        this.impactAnalyzer   = impactAnalyzer;
        this.confidenceEngine = confidenceEngine;
        this.executionEngine  = executionEngine;
        this.summaryWriter    = summaryWriter;
        this.previewAdvisor   = previewAdvisor;
        this.eventBus         = eventBus;
        this.settings         = settings;
        this.objectMapper     = objectMapper;
    }

    // =========================================================================
    // MAIN ENTRY POINTS
    // =========================================================================

    /** Full run with impact analysis from the configured ImpactAnalyzer. */
    public ReasoningResult process(ChangeRequest request, TargetComponent component, RepoContext repo) {
        return run(request, null, component, repo);
    }

    /** Full run with a caller-supplied impact analysis. */
    public ReasoningResult process(ChangeRequest        request,
                                   ChangeImpactAnalysis impact,
                                   TargetComponent      component,
                                   RepoContext          repo) {
        Objects.requireNonNull(impact, "impact");
        return run(request, impact, component, repo);
    }

    /**
     * Analysis and assessment only. Neither the backend nor the validator is called.
     *
     * @throws PipelineException when analysis or assessment fails
     */
    public DryRunPreview dryRun(ChangeRequest request, TargetComponent component, RepoContext repo) {
        Objects.requireNonNull(request, "request");
        publish(EventType.ANALYSIS_STARTED, request, Map.of("mode", "dry-run"));

        ChangeImpactAnalysis       impact     = analyze(request, component, repo);
        ChangeConfidenceAssessment assessment = assess(request, impact, component, repo);
        DryRunPreview              preview    = previewAdvisor.preview(assessment, impact);

        publish(EventType.DRY_RUN_COMPLETED, request, Map.of(
                "approach",   preview.getApproach().getId(),
                "confidence", assessment.getConfidence()));

        log.info("[Orchestrator] Dry run request={} approach={} confidence={}",
                request.getRequestId(), preview.getApproach().getId(),
                String.format("%.3f", assessment.getConfidence()));
        return preview;
    }

    /**
     * Runs independent requests concurrently on a bounded pool.
     * Results come back in input order; one failing item never affects another.
     */
    public List<ReasoningResult> processBatch(List<BatchItem> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }

        int threads = Math.min(settings.getBatchParallelism(), items.size());
        log.info("[Orchestrator] Batch of {} request(s) on {} thread(s)", items.size(), threads);

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<ReasoningResult>> futures = new ArrayList<>();
            for (BatchItem item : items) {
                futures.add(pool.submit(() -> process(item.getRequest(), item.getComponent(), item.getRepo())));
            }

            List<ReasoningResult> results = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                ChangeRequest request = items.get(i).getRequest();
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("[Orchestrator] Batch item {} failed", request.getRequestId(), cause);
                    results.add(fail(request, null, "batch", cause.getMessage()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[Orchestrator] Batch interrupted at item {}", i);
                    for (int j = i; j < futures.size(); j++) {
                        futures.get(j).cancel(true);
                        results.add(fail(items.get(j).getRequest(), null, "batch", "Batch interrupted"));
                    }
                    break;
                }
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    // =========================================================================
    // PIPELINE
    // =========================================================================

    private ReasoningResult run(ChangeRequest        request,
                                ChangeImpactAnalysis suppliedImpact,
                                TargetComponent      component,
                                RepoContext          repo) {
        Objects.requireNonNull(request, "request");
        long startTime = System.currentTimeMillis();

        log.info("========== EDITGUARD RUN START {} ==========", request.getRequestId());
        publish(EventType.ANALYSIS_STARTED, request, Map.of("target", String.valueOf(request.getElement())));

        ChangeConfidenceAssessment assessment = null;
        try {
            ChangeImpactAnalysis impact = suppliedImpact != null
                    ? suppliedImpact
                    : analyze(request, component, repo);

            assessment = assess(request, impact, component, repo);

            ExecutionResult execution = executionEngine.execute(request, assessment, impact, component, repo);

            String summary = summaryWriter.write(request, assessment, impact, execution);

            ReasoningResult result = ReasoningResult.completed(
                    request.getRequestId(),
                    execution.getFileChanges(),
                    assessment,
                    execution.getValidation(),
                    execution.getStrategyUsed(),
                    execution.getExecutionLog(),
                    summary);

            publish(EventType.EXECUTION_COMPLETED, request, Map.of(
                    "passed",   result.isSuccess(),
                    "strategy", execution.getStrategyUsed().getId(),
                    "attempts", execution.attemptCount()));

            if (result.isSuccess()) {
                log.info("========== EDITGUARD SUCCESS ==========");
            } else {
                log.warn("========== EDITGUARD FAILED VALIDATION ==========");
            }
            logOutcome(result, startTime, execution.attemptCount());
            return result;

        } catch (PipelineException e) {
            log.error("[Orchestrator] Stage '{}' failed: {}", e.getStage(), e.getMessage(), e);
            ReasoningResult result = fail(request, assessment, e.getStage(), e.getMessage());
            logOutcome(result, startTime, 0);
            return result;

        } catch (RuntimeException e) {
            log.error("[Orchestrator] Unexpected failure", e);
            ReasoningResult result = fail(request, assessment, "pipeline",
                    e.getClass().getSimpleName() + ": " + e.getMessage());
            logOutcome(result, startTime, 0);
            return result;
        }
    }

    private ChangeImpactAnalysis analyze(ChangeRequest request, TargetComponent component, RepoContext repo) {
        try {
            ChangeImpactAnalysis impact = impactAnalyzer.analyze(
                    request,
                    Objects.requireNonNull(component, "component"),
                    Objects.requireNonNull(repo, "repo"));
            log.info("[Orchestrator] Impact: {}", impact);
            return impact;
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipelineException("analysis", "Impact analysis failed: " + e.getMessage(), e);
        }
    }

    private ChangeConfidenceAssessment assess(ChangeRequest        request,
                                              ChangeImpactAnalysis impact,
                                              TargetComponent      component,
                                              RepoContext          repo) {
        ChangeConfidenceAssessment assessment;
        try {
            assessment = confidenceEngine.assess(
                    request,
                    impact,
                    Objects.requireNonNull(component, "component"),
                    Objects.requireNonNull(repo, "repo"));
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipelineException("assessment", "Confidence assessment failed: " + e.getMessage(), e);
        }

        publish(EventType.ASSESSMENT_COMPLETED, request, Map.of(
                "confidence", assessment.getConfidence(),
                "approach",   assessment.getRecommendedApproach().getId(),
                "risk",       assessment.getRiskLevel().displayName()));
        log.info("[Orchestrator] Assessment: {}", assessment);
        return assessment;
    }

    private ReasoningResult fail(ChangeRequest request, ChangeConfidenceAssessment assessment,
                                 String stage, String message) {
        String error = message != null ? message : "Unknown error";
        publish(EventType.PIPELINE_FAILED, request, Map.of("stage", stage, "error", error));
        return ReasoningResult.failed(
                request.getRequestId(),
                assessment,
                error,
                summaryWriter.writeFailure(request, assessment, stage, error));
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private void publish(EventType type, ChangeRequest request, Map<String, Object> payload) {
        eventBus.publish(type, SOURCE, request.getRequestId(), payload);
    }

    private void logOutcome(ReasoningResult result, long startTime, int attempts) {
        Map<String, Object> outcome = new LinkedHashMap<>();
        outcome.put("request_id",   result.getRequestId());
        outcome.put("success",      result.isSuccess());
        outcome.put("strategy",     result.getStrategyUsed().map(a -> a.getId()).orElse("none"));
        outcome.put("confidence",   result.getAssessment().map(a -> a.getConfidence()).orElse(0.0));
        outcome.put("attempts",     attempts);
        outcome.put("files",        result.getFileChanges().size());
        outcome.put("human_review", result.requiresHumanReview());
        outcome.put("wall_time_ms", System.currentTimeMillis() - startTime);
        outcome.put("error",        result.getError().orElse(""));

        try {
            log.info("[Outcome] {}", objectMapper.writeValueAsString(outcome));
        } catch (JsonProcessingException e) {
            log.warn("[Outcome] Could not serialize outcome for {}: {}", result.getRequestId(), e.getMessage());
        }
    }
}
