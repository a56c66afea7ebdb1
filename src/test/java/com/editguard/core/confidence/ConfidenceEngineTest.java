package com.editguard.core.confidence;

import com.editguard.Fixtures;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.impact.ExpectedScope;
import com.editguard.core.impact.RiskLevel;
import com.editguard.core.impact.ScopeTier;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.validation.ValidationLevel;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceEngineTest {

    private final ConfidenceEngine engine = new ConfidenceEngine();

    @Test
    void testWellFormedFontSizeEditIsHighConfidenceDirect() {
        ChangeRequest request = Fixtures.fontSizeRequest();

        ChangeConfidenceAssessment assessment = engine.assess(
                request, Fixtures.minimalImpact(request), Fixtures.button(), Fixtures.richRepo());

        assertEquals(0.944, assessment.getConfidence(), 1e-9);
        assertEquals(ChangeApproach.HIGH_CONFIDENCE_DIRECT, assessment.getRecommendedApproach());
        assertEquals(RiskLevel.LOW, assessment.getRiskLevel());
        assertEquals(List.of(ChangeApproach.MEDIUM_CONFIDENCE_GUIDED, ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE),
                assessment.getFallbackApproaches());
        assertFalse(assessment.requiresHumanReview());
    }

    @Test
    void testVagueRequestGoesToHumanReview() {
        ChangeConfidenceAssessment assessment = engine.assess(
                Fixtures.vagueRequest(), Fixtures.majorImpact(), Fixtures.opaqueButton(), Fixtures.emptyRepo());

        assertEquals(0.325, assessment.getConfidence(), 1e-9);
        assertTrue(assessment.getConfidence() < 0.4);
        assertEquals(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW, assessment.getRecommendedApproach());
        assertTrue(assessment.getFallbackApproaches().isEmpty());
        assertEquals(RiskLevel.HIGH, assessment.getRiskLevel());
        assertTrue(assessment.requiresHumanReview());
    }

    @Test
    void testFactorScores() {
        ChangeRequest request = Fixtures.fontSizeRequest();

        assertEquals(1.0, engine.visualClarity(request), 1e-9);
        assertEquals(0.5, engine.visualClarity(Fixtures.vagueRequest()), 1e-9);
        assertEquals(1.0, engine.componentUnderstanding(Fixtures.button(), Fixtures.richRepo()), 1e-9);
        assertEquals(0.3, engine.componentUnderstanding(Fixtures.opaqueButton(), Fixtures.emptyRepo()), 1e-9);
        assertEquals(0.8, engine.changeSimplicity(Fixtures.minimalImpact(request)), 1e-9);
        assertEquals(0.1, engine.changeSimplicity(Fixtures.majorImpact()), 1e-9);
        assertEquals(0.96, engine.contextCompleteness(Fixtures.richRepo()), 1e-9);
        assertEquals(0.4, engine.contextCompleteness(Fixtures.emptyRepo()), 1e-9);
    }

    @Test
    void testConfidenceStaysWithinBoundsAndBand() {
        ChangeRequest request = Fixtures.fontSizeRequest();
        List<ChangeConfidenceAssessment> assessments = List.of(
                engine.assess(request, Fixtures.minimalImpact(request), Fixtures.button(), Fixtures.richRepo()),
                engine.assess(request, Fixtures.majorImpact(), Fixtures.opaqueButton(), Fixtures.emptyRepo()),
                engine.assess(Fixtures.vagueRequest(), Fixtures.majorImpact(), Fixtures.opaqueButton(), Fixtures.emptyRepo()),
                engine.assess(request, impactWith(RiskLevel.MEDIUM), Fixtures.button(), Fixtures.richRepo()));

        for (ChangeConfidenceAssessment a : assessments) {
            assertTrue(a.getConfidence() >= ConfidenceEngine.MIN_CONFIDENCE, a.toString());
            assertTrue(a.getConfidence() <= ConfidenceEngine.MAX_CONFIDENCE, a.toString());
            assertTrue(engine.meetsThreshold(a.getConfidence(), a.getRecommendedApproach()), a.toString());
            assertFalse(ChangeApproach.forConfidence(a.getConfidence())
                    .isMoreConservativeThan(a.getRecommendedApproach()), a.toString());
        }
    }

    @Test
    void testRiskDowngradesDirectToGuided() {
        ChangeRequest request = Fixtures.fontSizeRequest();

        ChangeConfidenceAssessment assessment = engine.assess(
                request, impactWith(RiskLevel.MEDIUM), Fixtures.button(), Fixtures.richRepo());

        // 0.3 + 0.3 + 0.25 * 0.7 + 0.15 * 0.96
        assertEquals(0.919, assessment.getConfidence(), 1e-9);
        assertEquals(ChangeApproach.MEDIUM_CONFIDENCE_GUIDED, assessment.getRecommendedApproach());
        assertEquals(RiskLevel.LOW, assessment.getRiskLevel(), "high confidence relaxes MEDIUM to LOW");
    }

    @Test
    void testHighRiskSkipsGuided() {
        ChangeRequest request = Fixtures.fontSizeRequest();

        ChangeConfidenceAssessment assessment = engine.assess(
                request, impactWith(RiskLevel.HIGH), Fixtures.button(), Fixtures.richRepo());

        assertEquals(ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE, assessment.getRecommendedApproach());
    }

    @Test
    void testUnclearIntentAppendsHumanReviewFallback() {
        ConfidenceFactors unclear = new ConfidenceFactors(0.3, 0.9, 0.9, 0.9);
        ConfidenceFactors clear   = new ConfidenceFactors(0.9, 0.9, 0.9, 0.9);

        assertEquals(List.of(ChangeApproach.MEDIUM_CONFIDENCE_GUIDED,
                        ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE,
                        ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW),
                engine.fallbacksFor(ChangeApproach.HIGH_CONFIDENCE_DIRECT, unclear));
        assertEquals(List.of(ChangeApproach.MEDIUM_CONFIDENCE_GUIDED, ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE),
                engine.fallbacksFor(ChangeApproach.HIGH_CONFIDENCE_DIRECT, clear));
        assertEquals(List.of(ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE, ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW),
                engine.fallbacksFor(ChangeApproach.MEDIUM_CONFIDENCE_GUIDED, unclear));
        assertTrue(engine.fallbacksFor(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW, unclear).isEmpty());
    }

    @Test
    void testAssessmentIsIdempotent() {
        ChangeRequest        request = Fixtures.fontSizeRequest();
        ChangeImpactAnalysis impact  = Fixtures.minimalImpact(request);

        ChangeConfidenceAssessment first  = engine.assess(request, impact, Fixtures.button(), Fixtures.richRepo());
        ChangeConfidenceAssessment second = engine.assess(request, impact, Fixtures.button(), Fixtures.richRepo());

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void testThresholdHelpers() {
        assertEquals(0.8, engine.thresholdFor(ChangeApproach.HIGH_CONFIDENCE_DIRECT));
        assertTrue(engine.meetsThreshold(0.6, ChangeApproach.MEDIUM_CONFIDENCE_GUIDED));
        assertFalse(engine.meetsThreshold(0.59, ChangeApproach.MEDIUM_CONFIDENCE_GUIDED));
        assertEquals(ChangeApproach.HIGH_CONFIDENCE_DIRECT, engine.approachFor(1.0));
        assertEquals(ChangeApproach.HIGH_CONFIDENCE_DIRECT, engine.approachFor(0.8));
        assertEquals(ChangeApproach.MEDIUM_CONFIDENCE_GUIDED, engine.approachFor(0.79));
        assertEquals(ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE, engine.approachFor(0.4));
        assertEquals(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW, engine.approachFor(0.0));
    }

    @Test
    void testRecommendedValidationLevel() {
        ChangeRequest request = Fixtures.fontSizeRequest();

        ChangeConfidenceAssessment high = engine.assess(
                request, Fixtures.minimalImpact(request), Fixtures.button(), Fixtures.richRepo());
        ChangeConfidenceAssessment low = engine.assess(
                Fixtures.vagueRequest(), Fixtures.majorImpact(), Fixtures.opaqueButton(), Fixtures.emptyRepo());

        assertEquals(ValidationLevel.STANDARD, engine.recommendedValidationLevel(high));
        assertEquals(ValidationLevel.PARANOID, engine.recommendedValidationLevel(low));
    }

    private static ChangeImpactAnalysis impactWith(RiskLevel risk) {
        return new ChangeImpactAnalysis(
                new ExpectedScope(2, 1, ScopeTier.MINIMAL, risk),
                List.of(), List.of(), List.of(), List.of());
    }
}
