package com.editguard.core.repo;

import java.util.Map;

/**
 * StylingPatterns: how often each value of a styling family occurs across the
 * repository (e.g. "16px" → 42 for font size).
 */
public class StylingPatterns {

    private final Map<String, Integer> fontSizes;
    private final Map<String, Integer> colors;
    private final Map<String, Integer> spacing;

    public StylingPatterns(Map<String, Integer> fontSizes,
                           Map<String, Integer> colors,
                           Map<String, Integer> spacing) {
        this.fontSizes = fontSizes != null ? Map.copyOf(fontSizes) : Map.of();
        this.colors    = colors    != null ? Map.copyOf(colors)    : Map.of();
        this.spacing   = spacing   != null ? Map.copyOf(spacing)   : Map.of();
    }

    public Map<String, Integer> getFontSizes() { return fontSizes; }
    public Map<String, Integer> getColors()    { return colors; }
    public Map<String, Integer> getSpacing()   { return spacing; }

    public boolean isEmpty() {
        return fontSizes.isEmpty() && colors.isEmpty() && spacing.isEmpty();
    }
}
