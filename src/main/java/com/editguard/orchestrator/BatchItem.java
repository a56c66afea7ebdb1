package com.editguard.orchestrator;

import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeRequest;

import java.util.Objects;

/** One independent unit of work for ReasoningOrchestrator.processBatch. */
public final class BatchItem {

    private final ChangeRequest   request;
    private final TargetComponent component;
    private final RepoContext     repo;

    public BatchItem(ChangeRequest request, TargetComponent component, RepoContext repo) {
        this.request   = Objects.requireNonNull(request, "request");
        this.component = Objects.requireNonNull(component, "component");
        this.repo      = Objects.requireNonNull(repo, "repo");
    }

    public ChangeRequest   getRequest()   { return request; }
    public TargetComponent getComponent() { return component; }
    public RepoContext     getRepo()      { return repo; }
}
