package com.editguard.core.validation;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ValidationMetrics: size of a proposed change, measured on line counts.
 *
 * Lines are counted by splitting on '\n' (an empty file is one line).
 * added/removed are the net growth/shrinkage, so a same-length rewrite reports zero.
 */
public final class ValidationMetrics {

    private static final List<Pattern> COMPLEXITY_MARKERS = List.of(
            Pattern.compile("function\\s+\\w+"),
            Pattern.compile("const\\s+\\w+\\s*="),
            Pattern.compile("=>\\s*\\{"),
            Pattern.compile("if\\s*\\("),
            Pattern.compile("for\\s*\\("),
            Pattern.compile("while\\s*\\("),
            Pattern.compile("<\\w+")
    );

    private final int    linesAdded;
    private final int    linesRemoved;
    private final int    linesChanged;
    private final int    filesModified;
    private final double changeRatio;
    private final int    complexityDelta;

    public ValidationMetrics(int linesAdded, int linesRemoved, int filesModified,
                             double changeRatio, int complexityDelta) {
        this.linesAdded      = linesAdded;
        this.linesRemoved    = linesRemoved;
        this.linesChanged    = linesAdded + linesRemoved;
        this.filesModified   = filesModified;
        this.changeRatio     = changeRatio;
        this.complexityDelta = complexityDelta;
    }

    public static ValidationMetrics compute(String original, String proposed) {
        int originalLines = lineCount(original);
        int proposedLines = lineCount(proposed);

        int added   = Math.max(0, proposedLines - originalLines);
        int removed = Math.max(0, originalLines - proposedLines);
        double ratio = originalLines > 0 ? (double) (added + removed) / originalLines : 0.0;

        int complexityDelta = complexity(proposed) - complexity(original);

        return new ValidationMetrics(added, removed, 1, ratio, complexityDelta);
    }

    static int lineCount(String content) {
        if (content == null) return 0;
        return content.split("\n", -1).length;
    }

    static int complexity(String content) {
        if (content == null || content.isEmpty()) return 0;
        int total = 0;
        for (Pattern marker : COMPLEXITY_MARKERS) {
            Matcher m = marker.matcher(content);
            while (m.find()) total++;
        }
        return total;
    }

    public int    getLinesAdded()      { return linesAdded; }
    public int    getLinesRemoved()    { return linesRemoved; }
    public int    getLinesChanged()    { return linesChanged; }
    public int    getFilesModified()   { return filesModified; }
    public double getChangeRatio()     { return changeRatio; }
    public int    getComplexityDelta() { return complexityDelta; }

    @Override
    public String toString() {
        return String.format("+%d/-%d lines (%.1f%% of file), complexity %+d",
                linesAdded, linesRemoved, changeRatio * 100, complexityDelta);
    }
}
