package com.editguard.core.request;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * ChangeRequest: immutable description of one requested UI change.
 *
 * A request carries a target element, an ordered list of property edits and an
 * optional free-text intent. Either the edits or the intent may be empty, never
 * null. Created once per invocation and discarded after the run.
 */
public final class ChangeRequest {

    private final String             requestId;
    private final TargetElement      element;
    private final List<PropertyEdit> edits;
    private final String             intentDescription;
    private final Instant            createdAt;

    public ChangeRequest(TargetElement element, List<PropertyEdit> edits, String intentDescription) {
        this.requestId         = UUID.randomUUID().toString();
        this.element           = element != null ? element : new TargetElement("", "", "");
        this.edits             = edits != null ? List.copyOf(edits) : List.of();
        this.intentDescription = intentDescription != null ? intentDescription.trim() : "";
        this.createdAt         = Instant.now();
    }

    public String             getRequestId()         { return requestId; }
    public TargetElement      getElement()           { return element; }
    public List<PropertyEdit> getEdits()             { return edits; }
    public String             getIntentDescription() { return intentDescription; }
    public Instant            getCreatedAt()         { return createdAt; }

    public boolean hasIntentDescription() {
        return !intentDescription.isEmpty();
    }

    /**
     * Category that drives validation thresholds: the first edit's category,
     * CONTENT when the request carries only free text.
     */
    public ChangeCategory primaryCategory() {
        return edits.isEmpty() ? ChangeCategory.CONTENT : edits.get(0).getCategory();
    }

    public boolean touchesFontSize() {
        return edits.stream().anyMatch(PropertyEdit::isFontSizeLike);
    }

    public ImpactLevel maxImpact() {
        ImpactLevel max = ImpactLevel.LOW;
        for (PropertyEdit edit : edits) {
            if (edit.getImpact().ordinal() > max.ordinal()) {
                max = edit.getImpact();
            }
        }
        return max;
    }

    /** Human-readable intent: the description if given, otherwise the edits themselves. */
    public String describe() {
        if (hasIntentDescription()) {
            return intentDescription;
        }
        if (edits.isEmpty()) {
            return "Unspecified change on " + element;
        }
        return edits.stream()
                .map(PropertyEdit::toString)
                .collect(Collectors.joining("; "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeRequest)) return false;
        return requestId.equals(((ChangeRequest) o).requestId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId);
    }

    @Override
    public String toString() {
        return String.format("ChangeRequest{id=%s, element=%s, edits=%d, intent='%s'}",
                requestId, element, edits.size(), intentDescription);
    }
}
