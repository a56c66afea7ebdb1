package com.editguard.core.prompt;

import com.editguard.core.confidence.ChangeApproach;

/**
 * GeneratedPrompt: rendered instruction plus pacing metadata.
 *
 * contextTokens is a ~4-characters-per-token estimate of the prompt itself;
 * expectedResponseTokens is 500 scaled by the scope tier (1×..4×).
 */
public final class GeneratedPrompt {

    private final String         content;
    private final ChangeApproach approach;
    private final double         confidence;
    private final int            contextTokens;
    private final int            expectedResponseTokens;

    public GeneratedPrompt(String content, ChangeApproach approach, double confidence,
                           int contextTokens, int expectedResponseTokens) {
        this.content                = content;
        this.approach               = approach;
        this.confidence             = confidence;
        this.contextTokens          = contextTokens;
        this.expectedResponseTokens = expectedResponseTokens;
    }

    public String         getContent()                { return content; }
    public ChangeApproach getApproach()               { return approach; }
    public double         getConfidence()             { return confidence; }
    public int            getContextTokens()          { return contextTokens; }
    public int            getExpectedResponseTokens() { return expectedResponseTokens; }

    @Override
    public String toString() {
        return String.format("GeneratedPrompt{approach=%s, contextTokens=%d, expectedResponseTokens=%d}",
                approach, contextTokens, expectedResponseTokens);
    }
}
