package com.editguard.core.prompt;

import com.editguard.core.confidence.ChangeConfidenceAssessment;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeRequest;

import java.util.Objects;

/**
 * Everything the prompt builder reads. Every part is an immutable snapshot,
 * so the same context always renders the same prompt.
 */
public final class PromptContext {

    private final ChangeRequest              request;
    private final ChangeConfidenceAssessment assessment;
    private final ChangeImpactAnalysis       impact;
    private final TargetComponent            component;
    private final RepoContext                repo;

    public PromptContext(ChangeRequest              request,
                         ChangeConfidenceAssessment assessment,
                         ChangeImpactAnalysis       impact,
                         TargetComponent            component,
                         RepoContext                repo) {
        this.request    = Objects.requireNonNull(request,    "request");
        this.assessment = Objects.requireNonNull(assessment, "assessment");
        this.impact     = Objects.requireNonNull(impact,     "impact");
        this.component  = Objects.requireNonNull(component,  "component");
        this.repo       = Objects.requireNonNull(repo,       "repo");
    }

    public ChangeRequest              getRequest()    { return request; }
    public ChangeConfidenceAssessment getAssessment() { return assessment; }
    public ChangeImpactAnalysis       getImpact()     { return impact; }
    public TargetComponent            getComponent()  { return component; }
    public RepoContext                getRepo()       { return repo; }
}
