package com.editguard.core.repo;

import java.util.Map;

/**
 * DesignTokens: named design-system values (colors, spacing, typography).
 * Maps are copied at construction and iterate in insertion order of the source map.
 */
public class DesignTokens {

    private final Map<String, String> colors;
    private final Map<String, String> spacing;
    private final Map<String, String> typography;

    public DesignTokens(Map<String, String> colors,
                        Map<String, String> spacing,
                        Map<String, String> typography) {
        this.colors     = colors     != null ? Map.copyOf(colors)     : Map.of();
        this.spacing    = spacing    != null ? Map.copyOf(spacing)    : Map.of();
        this.typography = typography != null ? Map.copyOf(typography) : Map.of();
    }

    public Map<String, String> getColors()     { return colors; }
    public Map<String, String> getSpacing()    { return spacing; }
    public Map<String, String> getTypography() { return typography; }

    public boolean isEmpty() {
        return colors.isEmpty() && spacing.isEmpty() && typography.isEmpty();
    }
}
