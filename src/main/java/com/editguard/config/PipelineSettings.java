package com.editguard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * PipelineSettings: tunables for execution, backend pacing, validation and batching.
 *
 * Bound from application.properties; every key has a default so the pipeline
 * runs without any configuration. Unit tests build instances through
 * {@link #defaults()} or the constructor directly.
 */
@Component
public class PipelineSettings {

    private final int     maxAttempts;
    private final int     maxRateLimitWaits;
    private final long    baseBackoffMs;
    private final long    maxJitterMs;
    private final boolean syntaxCheckEnabled;
    private final boolean intentCheckEnabled;
    private final boolean preservationCheckEnabled;
    private final int     batchParallelism;

    public PipelineSettings(
            @Value("${editguard.execution.max-attempts:3}")           int     maxAttempts,
            @Value("${editguard.generation.max-rate-limit-waits:5}")  int     maxRateLimitWaits,
            @Value("${editguard.generation.base-backoff-ms:2000}")    long    baseBackoffMs,
            @Value("${editguard.generation.max-jitter-ms:500}")       long    maxJitterMs,
            @Value("${editguard.validation.syntax-check:true}")       boolean syntaxCheckEnabled,
            @Value("${editguard.validation.intent-check:true}")       boolean intentCheckEnabled,
            @Value("${editguard.validation.preservation-check:true}") boolean preservationCheckEnabled,
            @Value("${editguard.batch.parallelism:4}")                int     batchParallelism
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("editguard.execution.max-attempts must be >= 1, was " + maxAttempts);
        }
        this.maxAttempts              = maxAttempts;
        this.maxRateLimitWaits        = Math.max(0, maxRateLimitWaits);
        this.baseBackoffMs            = Math.max(0, baseBackoffMs);
        this.maxJitterMs              = Math.max(0, maxJitterMs);
        this.syntaxCheckEnabled       = syntaxCheckEnabled;
        this.intentCheckEnabled       = intentCheckEnabled;
        this.preservationCheckEnabled = preservationCheckEnabled;
        this.batchParallelism         = Math.max(1, batchParallelism);
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(3, 5, 2000, 500, true, true, true, 4);
    }

    public int     getMaxAttempts()              { return maxAttempts; }
    public int     getMaxRateLimitWaits()        { return maxRateLimitWaits; }
    public long    getBaseBackoffMs()            { return baseBackoffMs; }
    public long    getMaxJitterMs()              { return maxJitterMs; }
    public boolean isSyntaxCheckEnabled()        { return syntaxCheckEnabled; }
    public boolean isIntentCheckEnabled()        { return intentCheckEnabled; }
    public boolean isPreservationCheckEnabled()  { return preservationCheckEnabled; }
    public int     getBatchParallelism()         { return batchParallelism; }

    @Override
    public String toString() {
        return String.format("PipelineSettings{maxAttempts=%d, rateLimitWaits=%d, backoff=%dms+%dms, "
                        + "syntax=%s, intent=%s, preservation=%s, parallelism=%d}",
                maxAttempts, maxRateLimitWaits, baseBackoffMs, maxJitterMs,
                syntaxCheckEnabled, intentCheckEnabled, preservationCheckEnabled, batchParallelism);
    }
}
