package com.editguard.core.repo;

public enum ComplexityTier {
    SIMPLE,
    MODERATE,
    COMPLEX
}
