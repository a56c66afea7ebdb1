package com.editguard;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.llm.EchoGenerationBackend;
import com.editguard.llm.GenerationBackend;
import com.editguard.orchestrator.DryRunPreview;
import com.editguard.orchestrator.ReasoningOrchestrator;
import com.editguard.orchestrator.ReasoningResult;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("mock")
class EditGuardApplicationTest {

    @Autowired
    private ReasoningOrchestrator orchestrator;

    @Autowired
    private GenerationBackend backend;

    @Test
    void testMockProfileWiresEchoBackend() {
        assertInstanceOf(EchoGenerationBackend.class, backend);
    }

    @Test
    void testEndToEndFontSizeChange() {
        ReasoningResult result = orchestrator.process(Fixtures.fontSizeRequest(), Fixtures.button(), Fixtures.richRepo());

        assertTrue(result.isSuccess(), result.getSummary());
        assertTrue(result.getFileChanges().get(0).getNewContent().contains("fontSize: '16px'"));
        assertNotEquals(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW, result.getStrategyUsed().orElseThrow());

        System.out.println(result.getSummary());
    }

    @Test
    void testEndToEndDryRun() {
        DryRunPreview preview = orchestrator.dryRun(Fixtures.fontSizeRequest(), Fixtures.button(), Fixtures.richRepo());

        assertTrue(preview.getText().startsWith("DRY RUN ANALYSIS"));
    }
}
