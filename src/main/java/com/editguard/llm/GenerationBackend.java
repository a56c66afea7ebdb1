package com.editguard.llm;

import com.editguard.core.confidence.ChangeApproach;

/**
 * GenerationBackend: the single capability the pipeline needs from a model:
 * turn an instruction plus file context into proposed file content.
 *
 * ONE method contract: generate(GenerationRequest). Implementations report
 * transport problems as typed {@link GenerationResult}s and should not throw;
 * the execution engine still treats an escaping runtime exception as a
 * transient failure.
 *
 * temperatureFor(ChangeApproach) is a default method so the canonical
 * per-strategy temperatures live here, not in each backend.
 */
public interface GenerationBackend {

    GenerationResult generate(GenerationRequest request);

    /**
     * Sampling temperature per strategy.
     *
     * direct        0.2: trusted edit, a little latitude
     * guided        0.1
     * conservative  0.0: fully deterministic
     * human review  0.4: proposals benefit from alternatives
     */
    default double temperatureFor(ChangeApproach approach) {
        return switch (approach) {
            case HIGH_CONFIDENCE_DIRECT           -> 0.2;
            case MEDIUM_CONFIDENCE_GUIDED         -> 0.1;
            case LOW_CONFIDENCE_CONSERVATIVE      -> 0.0;
            case VERY_LOW_CONFIDENCE_HUMAN_REVIEW -> 0.4;
        };
    }
}
