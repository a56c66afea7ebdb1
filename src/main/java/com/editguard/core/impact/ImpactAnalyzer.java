package com.editguard.core.impact;

import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeRequest;

/**
 * ImpactAnalyzer: produces the impact analysis the rest of the pipeline consumes.
 *
 * Implementations must be pure: same inputs, same analysis.
 */
public interface ImpactAnalyzer {

    ChangeImpactAnalysis analyze(ChangeRequest request, TargetComponent component, RepoContext repo);
}
