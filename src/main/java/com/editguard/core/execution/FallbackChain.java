package com.editguard.core.execution;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.confidence.ChangeConfidenceAssessment;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * FallbackChain: the ordered strategies one execution may try.
 *
 * The chain starts at the recommended approach and only ever moves toward
 * more conservative approaches. Fallback entries that are not strictly more
 * conservative than the previous entry are dropped, so a chain never revisits
 * or un-escalates a strategy.
 *
 * Immutable: advance() returns a new chain positioned one step further.
 */
public final class FallbackChain {

    private final List<ChangeApproach> approaches;
    private final int                  position;

    private FallbackChain(List<ChangeApproach> approaches, int position) {
        this.approaches = approaches;
        this.position   = position;
    }

    public static FallbackChain start(ChangeConfidenceAssessment assessment) {
        return of(assessment.getRecommendedApproach(), assessment.getFallbackApproaches());
    }

    public static FallbackChain of(ChangeApproach recommended, List<ChangeApproach> fallbacks) {
        List<ChangeApproach> ordered = new ArrayList<>();
        ordered.add(recommended);
        ChangeApproach last = recommended;
        for (ChangeApproach next : fallbacks) {
            if (next.isMoreConservativeThan(last)) {
                ordered.add(next);
                last = next;
            }
        }
        return new FallbackChain(List.copyOf(ordered), 0);
    }

    public ChangeApproach current() {
        if (isExhausted()) {
            throw new NoSuchElementException("Fallback chain exhausted after " + approaches.size() + " strategies");
        }
        return approaches.get(position);
    }

    public FallbackChain advance() {
        return new FallbackChain(approaches, Math.min(position + 1, approaches.size()));
    }

    public boolean isExhausted() {
        return position >= approaches.size();
    }

    public List<ChangeApproach> getApproaches() {
        return approaches;
    }

    public List<ChangeApproach> remaining() {
        return isExhausted() ? List.of() : approaches.subList(position, approaches.size());
    }

    @Override
    public String toString() {
        return "FallbackChain" + approaches + "@" + position;
    }
}
