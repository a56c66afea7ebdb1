package com.editguard.core.execution;

import com.editguard.communication.EventBus;
import com.editguard.config.PipelineSettings;
import com.editguard.core.PipelineException;
import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.event.EventType;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.prompt.ContextualPromptBuilder;
import com.editguard.core.prompt.GeneratedPrompt;
import com.editguard.core.prompt.PromptContext;
import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.request.PropertyEdit;
import com.editguard.core.validation.ValidationEngine;
import com.editguard.core.validation.ValidationIssue;
import com.editguard.core.validation.ValidationLevel;
import com.editguard.core.validation.ValidationResult;
import com.editguard.llm.GenerationBackend;
import com.editguard.llm.GenerationRequest;
import com.editguard.llm.GenerationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * AdaptiveExecutionEngine: runs the generate → validate loop for one request.
 *
 * LOOP:
 *   1. Start at the recommended approach (FallbackChain.start)
 *   2. Build the prompt for the current approach and call the backend
 *   3. Validate the output against the original file
 *   4. Passed → return. Failed → escalate to the next, more conservative
 *      approach, until the chain runs out or the attempt limit is reached
 *
 * BACKEND OUTCOMES:
 *   RATE_LIMITED       wait (Retry-After if given, else exponential backoff with
 *                      jitter) and retry the same call. Waits never count as attempts.
 *   TRANSIENT/PERMANENT the attempt fails with a GENERATION_FAILED issue; escalation continues
 *   CANCELLED          the attempt fails and the loop stops
 *
 * HUMAN REVIEW:
 *   Output is a proposal: commentary above the untouched original. When the
 *   backend cannot produce one, the proposal is assembled locally so the
 *   terminal strategy always yields reviewable output.
 *
 * The latest attempt's validation is always the one returned.
 */
@Component
public class AdaptiveExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveExecutionEngine.class);

    private static final String SOURCE = "AdaptiveExecutionEngine";

    /** Outputs shorter than this share of the original trigger one correction prompt. */
    static final double MIN_RETAINED_LENGTH = 0.8;

    private static final int MAX_BACKOFF_SHIFT = 16;

    private final GenerationBackend       backend;
    private final ContextualPromptBuilder promptBuilder;
    private final ValidationEngine        validationEngine;
    private final PipelineSettings        settings;
    private final EventBus                eventBus;
    private final Sleeper                 sleeper;
    private final Random                  jitterRandom = new Random();

    @Autowired
    public AdaptiveExecutionEngine(GenerationBackend backend,
                                   ContextualPromptBuilder promptBuilder,
                                   ValidationEngine validationEngine,
                                   PipelineSettings settings,
                                   EventBus eventBus) {
        this(backend, promptBuilder, validationEngine, settings, eventBus, Sleeper.THREAD);
    }

    public AdaptiveExecutionEngine(GenerationBackend backend,
                                   ContextualPromptBuilder promptBuilder,
                                   ValidationEngine validationEngine,
                                   PipelineSettings settings,
                                   EventBus eventBus,
                                   Sleeper sleeper) {
        this.backend          = backend;
        this.promptBuilder    = promptBuilder;
        this.validationEngine = validationEngine;
        this.settings         = settings;
        this.eventBus         = eventBus;
        this.sleeper          = sleeper;
    }

    // =========================================================================
    // Public API
    // =========================================================================

    public ExecutionResult execute(ChangeRequest              request,
                                   ChangeConfidenceAssessment assessment,
                                   ChangeImpactAnalysis       impact,
                                   TargetComponent            component,
                                   RepoContext                repo) {

        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(assessment, "assessment");

        PromptContext context       = new PromptContext(request, assessment, impact, component, repo);
        FallbackChain chain         = FallbackChain.start(assessment);
        List<String>  executionLog  = new ArrayList<>();
        List<AttemptRecord> records = new ArrayList<>();

        executionLog.add(String.format("Initializing %s strategy (confidence %.0f%%)",
                chain.current().getId(), assessment.getConfidence() * 100));

        log.info("[Execution] Start request={} chain={} maxAttempts={}",
                request.getRequestId(), chain.getApproaches(), settings.getMaxAttempts());

        AttemptOutcome last;
        while (true) {
            ChangeApproach approach      = chain.current();
            int            attemptNumber = records.size() + 1;

            executionLog.add(String.format("Executing attempt %d of %d (%s)",
                    attemptNumber, settings.getMaxAttempts(), approach.getId()));

            last = runAttempt(context, approach, attemptNumber);
            records.add(last.record);
            executionLog.add(last.record.toLogSection().stripTrailing());

            if (last.record.isPassed()) {
                executionLog.add("Validation passed with " + approach.getId() + " strategy");
                break;
            }

            if (last.record.getOutcome() == AttemptRecord.Outcome.CANCELLED) {
                executionLog.add("Execution cancelled");
                log.warn("[Execution] Cancelled during attempt {}", attemptNumber);
                break;
            }

            FallbackChain next = chain.advance();
            if (next.isExhausted()) {
                executionLog.add("All fallback strategies exhausted");
                log.warn("[Execution] Chain exhausted after {} attempt(s)", records.size());
                break;
            }
            if (records.size() >= settings.getMaxAttempts()) {
                executionLog.add("Attempt limit reached (" + settings.getMaxAttempts() + ")");
                log.warn("[Execution] Attempt limit {} reached", settings.getMaxAttempts());
                break;
            }

            ChangeApproach escalated = next.current();
            executionLog.add("Switching to " + escalated.getId() + " strategy");
            log.info("[Execution] Escalating {} → {} ({})", approach.getId(), escalated.getId(),
                    last.record.getError());
            publish(EventType.STRATEGY_ESCALATED, request, Map.of(
                    "from",   approach.getId(),
                    "to",     escalated.getId(),
                    "reason", String.valueOf(last.record.getError())));
            chain = next;
        }

        ExecutionResult result = new ExecutionResult(
                last.changes,
                last.record.getApproach(),
                last.validation,
                executionLog,
                records);

        log.info("[Execution] Done {}", result);
        return result;
    }

    // =========================================================================
    // One attempt
    // =========================================================================

    private AttemptOutcome runAttempt(PromptContext context, ChangeApproach approach, int attemptNumber) {
        ChangeRequest   request   = context.getRequest();
        TargetComponent component = context.getComponent();
        String          original  = component.getContent();

        AttemptRecord.Builder record = AttemptRecord.builder(attemptNumber, approach);

        publish(EventType.ATTEMPT_STARTED, request, Map.of(
                "attempt",  attemptNumber,
                "approach", approach.getId()));

        GeneratedPrompt  prompt     = buildPrompt(context, approach);
        GenerationResult generation = invokeBackend(context, prompt, record);

        String newContent;
        String codeSection;
        String rationale;

        if (approach.isHumanReview()) {
            if (generation.isSuccess() && !generation.getContent().isBlank()) {
                newContent = proposalFrom(generation.getContent(), original);
            } else if (generation.getStatus() == GenerationResult.Status.CANCELLED) {
                return generationFailed(context, record, generation);
            } else {
                log.info("[Execution] Backend unavailable for proposal ({}); assembling locally",
                        generation.getErrorMessage());
                newContent = localProposal(context);
            }
            codeSection = codeSectionOf(newContent, original);
            rationale   = "Change proposal for human review: " + request.describe();

        } else {
            if (!generation.isSuccess()) {
                return generationFailed(context, record, generation);
            }
            newContent = ResponseContentExtractor.extract(generation.getContent(), original);
            if (newContent.isBlank()) {
                return generationFailed(context, record,
                        GenerationResult.transientFailure("Backend returned empty content"));
            }
            newContent  = correctOverDeletion(context, approach, newContent, record);
            codeSection = newContent;
            rationale   = "Applied " + approach.getId() + " strategy: " + request.describe();
        }

        ValidationResult validation = validate(context, original, codeSection);

        List<ValidationIssue> errors = validation.errors();
        record.errorCount(errors.size())
              .warningCount(validation.getWarnings().size())
              .outcome(validation.isPassed()
                      ? AttemptRecord.Outcome.PASSED
                      : AttemptRecord.Outcome.VALIDATION_FAILED);
        if (!errors.isEmpty()) {
            record.error(errors.get(0).getMessage());
        }
        AttemptRecord built = record.build();

        publish(EventType.ATTEMPT_VALIDATED, request, Map.of(
                "attempt",  attemptNumber,
                "approach", approach.getId(),
                "passed",   validation.isPassed(),
                "errors",   errors.size(),
                "warnings", validation.getWarnings().size()));

        FileAction action = original.isEmpty() ? FileAction.CREATE : FileAction.MODIFY;
        GeneratedChange change = new GeneratedChange(component.getFilePath(), action, original, newContent, rationale);

        return new AttemptOutcome(built, List.of(change), validation);
    }

    private GeneratedPrompt buildPrompt(PromptContext context, ChangeApproach approach) {
        try {
            return promptBuilder.build(context, approach);
        } catch (RuntimeException e) {
            throw new PipelineException("prompt", "Failed to build " + approach.getId() + " prompt", e);
        }
    }

    private ValidationResult validate(PromptContext context, String original, String proposed) {
        try {
            return validationEngine.validate(
                    original,
                    proposed,
                    context.getRequest(),
                    context.getAssessment(),
                    context.getImpact(),
                    context.getComponent().getStylingApproach());
        } catch (RuntimeException e) {
            throw new PipelineException("validation", "Validation failed unexpectedly", e);
        }
    }

    private AttemptOutcome generationFailed(PromptContext context,
                                            AttemptRecord.Builder record,
                                            GenerationResult generation) {
        boolean cancelled = generation.getStatus() == GenerationResult.Status.CANCELLED;
        String  reason    = String.format("Generation %s: %s",
                generation.getStatus().name().toLowerCase(), generation.getErrorMessage());

        ValidationResult validation = ValidationResult.notGenerated(
                reason,
                context.getAssessment().getConfidence(),
                ValidationLevel.forAssessment(context.getAssessment()));

        AttemptRecord built = record
                .outcome(cancelled ? AttemptRecord.Outcome.CANCELLED : AttemptRecord.Outcome.GENERATION_FAILED)
                .error(reason)
                .errorCount(1)
                .build();

        publish(EventType.ATTEMPT_VALIDATED, context.getRequest(), Map.of(
                "attempt",  built.getAttemptNumber(),
                "approach", built.getApproach().getId(),
                "passed",   false,
                "errors",   1,
                "warnings", 0));

        log.warn("[Execution] Attempt {} produced no output: {}", built.getAttemptNumber(), reason);
        return new AttemptOutcome(built, List.of(), validation);
    }

    // =========================================================================
    // Over-deletion correction
    // =========================================================================

    /**
     * One in-attempt correction when the output lost too much of the file.
     * The corrected output replaces the first one only when the backend delivers;
     * validation judges whichever content remains.
     */
    private String correctOverDeletion(PromptContext context, ChangeApproach approach,
                                       String content, AttemptRecord.Builder record) {
        String original = context.getComponent().getContent();
        if (original.isEmpty() || content.length() >= original.length() * MIN_RETAINED_LENGTH) {
            return content;
        }

        String failure = String.format(
                "Generated content is %d characters but the original is %d characters (%.0f%% retained)",
                content.length(), original.length(), 100.0 * content.length() / original.length());
        log.warn("[Execution] {}. Issuing correction prompt.", failure);
        record.correctionIssued(true);

        GeneratedPrompt  correction = promptBuilder.buildCorrectionPrompt(context, approach, failure);
        GenerationResult retry      = invokeBackend(context, correction, record);

        if (!retry.isSuccess()) {
            log.warn("[Execution] Correction call failed: {}", retry.getErrorMessage());
            return content;
        }
        String corrected = ResponseContentExtractor.extract(retry.getContent(), original);
        return corrected.isBlank() ? content : corrected;
    }

    // =========================================================================
    // Backend calls and rate limiting
    // =========================================================================

    private GenerationResult invokeBackend(PromptContext context, GeneratedPrompt prompt, AttemptRecord.Builder record) {
        TargetComponent component = context.getComponent();
        List<PropertyEdit> edits  = context.getRequest().getEdits();

        GenerationRequest generationRequest = new GenerationRequest(
                prompt.getContent(),
                prompt.getApproach(),
                component.getFilePath(),
                component.getContent(),
                edits);

        int waits = 0;
        while (true) {
            GenerationResult result = callBackend(generationRequest);
            if (!result.isRateLimited()) {
                return result;
            }

            if (waits >= settings.getMaxRateLimitWaits()) {
                return GenerationResult.transientFailure(
                        "Rate limit persisted after " + waits + " wait(s): " + result.getErrorMessage());
            }

            waits++;
            record.addRateLimitWaits(1);

            Duration wait = result.getRetryAfter().orElse(Duration.ofMillis(computeBackoff(waits)));

            log.warn("[Execution] Rate limited. Waiting {} ms (wait {}/{})",
                    wait.toMillis(), waits, settings.getMaxRateLimitWaits());
            publish(EventType.RATE_LIMIT_WAIT, context.getRequest(), Map.of(
                    "waitMs",   wait.toMillis(),
                    "wait",     waits,
                    "approach", prompt.getApproach().getId()));

            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return GenerationResult.cancelled("Interrupted while waiting out rate limit");
            }
        }
    }

    private GenerationResult callBackend(GenerationRequest generationRequest) {
        try {
            GenerationResult result = backend.generate(generationRequest);
            return result != null ? result : GenerationResult.transientFailure("Backend returned no result");
        } catch (CancellationException e) {
            return GenerationResult.cancelled("Generation cancelled");
        } catch (RuntimeException e) {
            log.warn("[Execution] Backend threw {}: {}", e.getClass().getSimpleName(), e.getMessage());
            return GenerationResult.transientFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** Exponential backoff with jitter */
    long computeBackoff(int wait) {
        int  shift       = Math.min(Math.max(wait, 1), MAX_BACKOFF_SHIFT) - 1;
        long exponential = settings.getBaseBackoffMs() * (1L << shift);
        long jitter      = settings.getMaxJitterMs() > 0 ? jitterRandom.nextLong(settings.getMaxJitterMs() + 1) : 0;
        return exponential + jitter;
    }

    // =========================================================================
    // Human review proposals
    // =========================================================================

    /**
     * Keeps a backend proposal as-is when it still carries the original source;
     * otherwise turns it into comments above the untouched original.
     */
    static String proposalFrom(String response, String original) {
        String text = ResponseContentExtractor.stripFenceLines(response);
        String body = original.stripTrailing();
        if (!body.isEmpty() && text.contains(body)) {
            return ResponseContentExtractor.withFinalNewlineOf(text, original);
        }
        return commentBlock(text.strip()) + "\n\n" + original;
    }

    private static String localProposal(PromptContext context) {
        ChangeRequest              request    = context.getRequest();
        ChangeConfidenceAssessment assessment = context.getAssessment();

        StringBuilder sb = new StringBuilder();
        sb.append("// CHANGE PROPOSAL - REQUIRES HUMAN REVIEW\n");
        sb.append("// Intent: ")
          .append(request.hasIntentDescription() ? request.getIntentDescription() : "(none given)")
          .append("\n");
        sb.append("// Target: ").append(request.getElement()).append("\n");
        sb.append(String.format("// Risk: %s (confidence %.0f%%)",
                assessment.getRiskLevel().displayName(), assessment.getConfidence() * 100)).append("\n");
        if (!request.getEdits().isEmpty()) {
            sb.append("// Requested edits:\n");
            for (PropertyEdit edit : request.getEdits()) {
                sb.append("//   - ").append(edit.getProperty()).append(": ")
                  .append(edit.getBefore()).append(" -> ").append(edit.getAfter()).append("\n");
            }
        }
        sb.append("// Original code preserved below:\n\n");
        sb.append(context.getComponent().getContent());
        return sb.toString();
    }

    private static String commentBlock(String text) {
        StringBuilder sb = new StringBuilder("// CHANGE PROPOSAL - REQUIRES HUMAN REVIEW");
        for (String line : text.split("\n", -1)) {
            sb.append("\n// ").append(line);
        }
        return sb.toString();
    }

    /** The part of a proposal starting at the preserved original; validation runs on this. */
    static String codeSectionOf(String proposal, String original) {
        String anchor = original.stripTrailing();
        if (anchor.isEmpty()) {
            return "";
        }
        int idx = proposal.indexOf(anchor);
        return idx >= 0 ? proposal.substring(idx) : proposal;
    }

    // =========================================================================
    // Events
    // =========================================================================

    private void publish(EventType type, ChangeRequest request, Map<String, Object> payload) {
        eventBus.publish(type, SOURCE, request.getRequestId(), payload);
    }

    private static final class AttemptOutcome {
        final AttemptRecord         record;
        final List<GeneratedChange> changes;
        final ValidationResult      validation;

        AttemptOutcome(AttemptRecord record, List<GeneratedChange> changes, ValidationResult validation) {
            this.record     = record;
            this.changes    = changes;
            this.validation = validation;
        }
    }
}
