package com.editguard.orchestrator;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.impact.ChangeImpactAnalysis;

import java.util.List;

/** What a run would do, computed without calling the backend or the validator. */
public final class DryRunPreview {

    private final ChangeConfidenceAssessment assessment;
    private final ChangeImpactAnalysis       impact;
    private final ChangeApproach             approach;
    private final List<String>               expectedChanges;
    private final List<String>               risks;
    private final List<String>               recommendations;
    private final String                     text;

    public DryRunPreview(ChangeConfidenceAssessment assessment,
                         ChangeImpactAnalysis       impact,
                         List<String>               expectedChanges,
                         List<String>               risks,
                         List<String>               recommendations,
                         String                     text) {
        this.assessment      = assessment;
        this.impact          = impact;
        this.approach        = assessment.getRecommendedApproach();
        this.expectedChanges = List.copyOf(expectedChanges);
        this.risks           = List.copyOf(risks);
        this.recommendations = List.copyOf(recommendations);
        this.text            = text;
    }

    public ChangeConfidenceAssessment getAssessment()      { return assessment; }
    public ChangeImpactAnalysis       getImpact()          { return impact; }
    public ChangeApproach             getApproach()        { return approach; }
    public List<String>               getExpectedChanges() { return expectedChanges; }
    public List<String>               getRisks()           { return risks; }
    public List<String>               getRecommendations() { return recommendations; }
    public String                     getText()            { return text; }

    @Override
    public String toString() {
        return text;
    }
}
