package com.editguard.core.impact;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PreservationRule: a pattern the proposed content must keep.
 *
 * Critical rules must keep the same number of occurrences as the original;
 * non-critical rules only have to survive with at least one occurrence.
 * Literal patterns are counted as non-overlapping substrings, regex patterns
 * with {@link Matcher#find()}.
 */
public class PreservationRule {

    public enum Type { FUNCTIONALITY, STRUCTURE, STYLING, ACCESSIBILITY, PERFORMANCE }

    private final Type    type;
    private final String  description;
    private final String  pattern;
    private final boolean regex;
    private final boolean critical;
    private final Pattern compiled;   // null for literal rules

    public PreservationRule(Type type, String description, String pattern, boolean regex, boolean critical) {
        this.type        = type;
        this.description = description != null ? description : "";
        this.pattern     = pattern != null ? pattern : "";
        this.regex       = regex;
        this.critical    = critical;
        this.compiled    = regex ? Pattern.compile(this.pattern) : null;
    }

    public static PreservationRule critical(Type type, String description, String regex) {
        return new PreservationRule(type, description, regex, true, true);
    }

    public static PreservationRule literal(Type type, String description, String text, boolean critical) {
        return new PreservationRule(type, description, text, false, critical);
    }

    public Type    getType()        { return type; }
    public String  getDescription() { return description; }
    public String  getPattern()     { return pattern; }
    public boolean isRegex()        { return regex; }
    public boolean isCritical()     { return critical; }

    public int countOccurrences(String content) {
        if (content == null || content.isEmpty() || pattern.isEmpty()) return 0;

        int count = 0;
        if (regex) {
            Matcher m = compiled.matcher(content);
            while (m.find()) count++;
            return count;
        }

        int from = 0;
        while ((from = content.indexOf(pattern, from)) >= 0) {
            count++;
            from += pattern.length();
        }
        return count;
    }

    @Override
    public String toString() {
        return String.format("PreservationRule{%s, %s, pattern=%s%s}",
                type, description, pattern, critical ? ", critical" : "");
    }
}
