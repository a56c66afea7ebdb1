package com.editguard.orchestrator;

import com.editguard.Fixtures;
import com.editguard.ScriptedGenerationBackend;
import com.editguard.communication.InMemoryEventBus;
import com.editguard.config.PipelineSettings;
import com.editguard.core.PipelineException;
import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.confidence.ConfidenceEngine;
import com.editguard.core.event.Event;
import com.editguard.core.event.EventType;
import com.editguard.core.execution.AdaptiveExecutionEngine;
import com.editguard.core.impact.HeuristicImpactAnalyzer;
import com.editguard.core.impact.ImpactAnalyzer;
import com.editguard.core.prompt.ContextualPromptBuilder;
import com.editguard.core.prompt.GeneratedPrompt;
import com.editguard.core.prompt.PromptContext;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.request.TargetElement;
import com.editguard.core.validation.IssueType;
import com.editguard.core.validation.LiteralIntentReflection;
import com.editguard.core.validation.UtilityClassIntentReflection;
import com.editguard.core.validation.ValidationEngine;
import com.editguard.llm.GenerationResult;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningOrchestratorTest {

    private final ScriptedGenerationBackend backend  = new ScriptedGenerationBackend();
    private final List<Event>               events   = new CopyOnWriteArrayList<>();
    private final PipelineSettings          settings = PipelineSettings.defaults();

    // ----------------------------------------------------------------
    // Scenarios
    // ----------------------------------------------------------------

    @Test
    void testWellFormedFontSizeChange() {
        backend.thenApplyEdits();
        ChangeRequest request = Fixtures.fontSizeRequest();

        ReasoningResult result = orchestrator(new HeuristicImpactAnalyzer())
                .process(request, Fixtures.minimalImpact(request), Fixtures.button(), Fixtures.richRepo());

        assertTrue(result.isSuccess());
        assertEquals(request.getRequestId(), result.getRequestId());
        assertEquals(ChangeApproach.HIGH_CONFIDENCE_DIRECT, result.getStrategyUsed().orElseThrow());
        assertEquals(0.944, result.getAssessment().orElseThrow().getConfidence(), 1e-9);
        assertFalse(result.requiresHumanReview());
        assertTrue(result.getError().isEmpty());
        assertTrue(result.getFileChanges().get(0).getNewContent().contains("fontSize: '16px'"));
        assertTrue(result.getSummary().contains("Change executed successfully with high-confidence-direct approach"));

        assertEquals(List.of(
                EventType.ANALYSIS_STARTED,
                EventType.ASSESSMENT_COMPLETED,
                EventType.ATTEMPT_STARTED,
                EventType.ATTEMPT_VALIDATED,
                EventType.EXECUTION_COMPLETED), eventTypes());
    }

    @Test
    void testBackgroundColorChangeRunsDirect() {
        backend.thenApplyEdits();
        ChangeRequest request = Fixtures.backgroundColorRequest();

        ReasoningResult result = orchestrator(new HeuristicImpactAnalyzer())
                .process(request, Fixtures.minimalImpact(request), Fixtures.button(), Fixtures.richRepo());

        assertTrue(result.isSuccess());
        assertTrue(result.getAssessment().orElseThrow().getConfidence() > 0.8);
        assertEquals(ChangeApproach.HIGH_CONFIDENCE_DIRECT, result.getStrategyUsed().orElseThrow());
        assertTrue(result.getFileChanges().get(0).getNewContent().contains("backgroundColor: 'red'"));
    }

    @Test
    void testHexBackgroundChangeThroughDefaultAnalysisRunsDirect() {
        backend.thenApplyEdits();
        ChangeRequest request = Fixtures.hexBackgroundRequest();

        ReasoningResult result = orchestrator(new HeuristicImpactAnalyzer())
                .process(request, Fixtures.button(Fixtures.HEX_BUTTON_SOURCE), Fixtures.richRepo());

        assertTrue(result.isSuccess(), result.getSummary());
        assertTrue(result.getAssessment().orElseThrow().getConfidence() > 0.8);
        assertEquals(ChangeApproach.HIGH_CONFIDENCE_DIRECT, result.getStrategyUsed().orElseThrow());
        assertFalse(result.requiresHumanReview());

        String updated = result.getFileChanges().get(0).getNewContent();
        assertTrue(updated.contains("backgroundColor: '#3B82F6'"));
        assertFalse(updated.contains("#1F2937"));
    }

    @Test
    void testEmptyRequestOnComplexComponentGoesToHumanReview() {
        backend.thenReturn(GenerationResult.success("Recommendation: say which element and property should change"));
        ChangeRequest request = new ChangeRequest(TargetElement.of("div", ""), List.of(), "");

        ReasoningResult result = orchestrator(new HeuristicImpactAnalyzer())
                .process(request, Fixtures.opaqueButton(), Fixtures.emptyRepo());

        assertTrue(result.getAssessment().orElseThrow().getConfidence() < 0.4);
        assertEquals(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW, result.getStrategyUsed().orElseThrow());
        assertTrue(result.requiresHumanReview());
        assertTrue(result.isSuccess());
        assertTrue(result.getFileChanges().get(0).getNewContent().endsWith(Fixtures.BUTTON_SOURCE));
    }

    @Test
    void testVagueRequestBecomesProposal() {
        backend.thenReturn(GenerationResult.success("Recommendation: name the property that should change"));

        ReasoningResult result = orchestrator(new HeuristicImpactAnalyzer())
                .process(Fixtures.vagueRequest(), Fixtures.majorImpact(), Fixtures.opaqueButton(), Fixtures.emptyRepo());

        assertTrue(result.getAssessment().orElseThrow().getConfidence() < 0.4);
        assertEquals(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW, result.getStrategyUsed().orElseThrow());
        assertTrue(result.requiresHumanReview());
        assertTrue(result.isSuccess());

        String proposal = result.getFileChanges().get(0).getNewContent();
        assertTrue(proposal.startsWith("// CHANGE PROPOSAL - REQUIRES HUMAN REVIEW"));
        assertTrue(proposal.endsWith(Fixtures.BUTTON_SOURCE));
        assertTrue(result.getSummary().contains("Change proposal ready for human review"));
    }

    @Test
    void testRetryExhaustionReportsLastStrategy() {
        String broken = Fixtures.BUTTON_SOURCE.replace("export default function Button", "function Button");
        backend.thenReturn(GenerationResult.success(broken));
        ChangeRequest request = Fixtures.fontSizeRequest();

        ReasoningResult result = orchestrator(new HeuristicImpactAnalyzer())
                .process(request, Fixtures.minimalImpact(request), Fixtures.button(), Fixtures.richRepo());

        assertFalse(result.isSuccess());
        assertEquals(ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE, result.getStrategyUsed().orElseThrow());
        assertTrue(result.getValidation().orElseThrow().hasError(IssueType.PRESERVATION_VIOLATION));
        assertTrue(result.getError().orElseThrow().contains("Component exports"));
        assertTrue(result.getSummary().contains("Change validation failed"));
        assertTrue(result.getSummary().contains("Suggestion:"));
        assertEquals(2, eventsOf(EventType.STRATEGY_ESCALATED).size());
        assertTrue(eventsOf(EventType.PIPELINE_FAILED).isEmpty());
    }

    @Test
    void testFatalAnalysisFailureIsReportedNotThrown() {
        ImpactAnalyzer failing = (request, component, repo) -> {
            throw new IllegalStateException("index unavailable");
        };

        ReasoningResult result = orchestrator(failing)
                .process(Fixtures.fontSizeRequest(), Fixtures.button(), Fixtures.richRepo());

        assertFalse(result.isSuccess());
        assertTrue(result.requiresHumanReview());
        assertTrue(result.getAssessment().isEmpty());
        assertTrue(result.getFileChanges().isEmpty());
        assertTrue(result.getError().orElseThrow().contains("index unavailable"));
        assertTrue(result.getSummary().contains("Pipeline failed at analysis"));
        assertEquals(0, backend.callCount());

        Event failed = eventsOf(EventType.PIPELINE_FAILED).get(0);
        assertEquals("analysis", failed.getPayload().get("stage"));
    }

    @Test
    void testPromptFailureKeepsAssessment() {
        backend.thenApplyEdits();
        ContextualPromptBuilder broken = new ContextualPromptBuilder() {
            @Override
            public GeneratedPrompt build(PromptContext context, ChangeApproach approach) {
                throw new IllegalStateException("template missing");
            }
        };
        ReasoningOrchestrator orchestrator = orchestrator(new HeuristicImpactAnalyzer(), broken);

        ReasoningResult result = orchestrator.process(Fixtures.fontSizeRequest(), Fixtures.button(), Fixtures.richRepo());

        assertFalse(result.isSuccess());
        assertTrue(result.getAssessment().isPresent());
        assertEquals("prompt", eventsOf(EventType.PIPELINE_FAILED).get(0).getPayload().get("stage"));
    }

    // ----------------------------------------------------------------
    // Dry run and batch
    // ----------------------------------------------------------------

    @Test
    void testDryRunNeverCallsBackend() {
        DryRunPreview preview = orchestrator(new HeuristicImpactAnalyzer())
                .dryRun(Fixtures.fontSizeRequest(), Fixtures.button(), Fixtures.richRepo());

        assertEquals(0, backend.callCount());
        assertEquals(preview.getAssessment().getRecommendedApproach(), preview.getApproach());
        assertTrue(preview.getText().startsWith("DRY RUN ANALYSIS"));
        assertTrue(preview.getText().endsWith("Ready to execute with " + preview.getApproach().getId() + " approach."));
        assertTrue(preview.getExpectedChanges().contains("1 related changes required"));
        assertEquals(List.of(EventType.ANALYSIS_STARTED, EventType.ASSESSMENT_COMPLETED, EventType.DRY_RUN_COMPLETED),
                eventTypes());
    }

    @Test
    void testDryRunFailureThrows() {
        ImpactAnalyzer failing = (request, component, repo) -> {
            throw new IllegalStateException("index unavailable");
        };

        PipelineException e = assertThrows(PipelineException.class,
                () -> orchestrator(failing).dryRun(Fixtures.fontSizeRequest(), Fixtures.button(), Fixtures.richRepo()));

        assertEquals("analysis", e.getStage());
    }

    @Test
    void testBatchKeepsInputOrder() {
        backend.thenApplyEdits();
        List<BatchItem> items = List.of(
                new BatchItem(Fixtures.fontSizeRequest(),       Fixtures.button(),       Fixtures.richRepo()),
                new BatchItem(Fixtures.vagueRequest(),          Fixtures.opaqueButton(), Fixtures.emptyRepo()),
                new BatchItem(Fixtures.backgroundColorRequest(), Fixtures.button(),      Fixtures.richRepo()));

        List<ReasoningResult> results = orchestrator(new HeuristicImpactAnalyzer()).processBatch(items);

        assertEquals(3, results.size());
        for (int i = 0; i < items.size(); i++) {
            assertEquals(items.get(i).getRequest().getRequestId(), results.get(i).getRequestId());
        }
        assertTrue(results.get(0).isSuccess());
        assertTrue(results.get(2).isSuccess());
    }

    @Test
    void testEmptyBatch() {
        assertTrue(orchestrator(new HeuristicImpactAnalyzer()).processBatch(List.of()).isEmpty());
    }

    // ----------------------------------------------------------------

    private ReasoningOrchestrator orchestrator(ImpactAnalyzer analyzer) {
        return orchestrator(analyzer, new ContextualPromptBuilder());
    }

    private ReasoningOrchestrator orchestrator(ImpactAnalyzer analyzer, ContextualPromptBuilder promptBuilder) {
        InMemoryEventBus bus = new InMemoryEventBus();
        bus.subscribe(events::add);

        ValidationEngine validationEngine = new ValidationEngine(settings,
                List.of(new LiteralIntentReflection(), new UtilityClassIntentReflection()));
        AdaptiveExecutionEngine executionEngine = new AdaptiveExecutionEngine(
                backend, promptBuilder, validationEngine, settings, bus, d -> { });

        return new ReasoningOrchestrator(
                analyzer,
                new ConfidenceEngine(),
                executionEngine,
                new ExecutionSummaryWriter(),
                new PreviewAdvisor(),
                bus,
                settings,
                new ObjectMapper());
    }

    private List<EventType> eventTypes() {
        return events.stream().map(Event::getType).collect(Collectors.toList());
    }

    private List<Event> eventsOf(EventType type) {
        return events.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }
}
