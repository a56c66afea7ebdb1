package com.editguard.core.request;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * PropertyEdit: one "before → after" change of a single CSS-like property.
 */
public class PropertyEdit {

    private static final Pattern KEBAB_BOUNDARY = Pattern.compile("-([a-z])");

    private final String         property;
    private final String         before;
    private final String         after;
    private final ChangeCategory category;
    private final ImpactLevel    impact;

    public PropertyEdit(
            String         property,
            String         before,
            String         after,
            ChangeCategory category,
            ImpactLevel    impact
    ) {
        this.property = Objects.requireNonNull(property, "property");
        this.before   = before != null ? before : "";
        this.after    = after  != null ? after  : "";
        this.category = category != null ? category : ChangeCategory.STYLING;
        this.impact   = impact   != null ? impact   : ImpactLevel.LOW;
    }

    /** Convenience factory for the common low-impact styling edit. */
    public static PropertyEdit styling(String property, String before, String after) {
        return new PropertyEdit(property, before, after, ChangeCategory.STYLING, ImpactLevel.LOW);
    }

    public String         getProperty() { return property; }
    public String         getBefore()   { return before; }
    public String         getAfter()    { return after; }
    public ChangeCategory getCategory() { return category; }
    public ImpactLevel    getImpact()   { return impact; }

    public boolean isFontSizeLike() {
        String p = property.toLowerCase();
        return p.equals("font-size") || p.equals("fontsize");
    }

    /** "background-color" → "backgroundColor", the spelling used by inline styles and CSS-in-JS. */
    public String camelCaseProperty() {
        Matcher m = KEBAB_BOUNDARY.matcher(property);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, m.group(1).toUpperCase());
        }
        m.appendTail(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return property + ": " + before + " → " + after;
    }
}
