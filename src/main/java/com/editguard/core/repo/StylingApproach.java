package com.editguard.core.repo;

/**
 * StylingApproach: how a component (or a whole repository) applies styles.
 *
 * TAILWIND and CSS_MODULES are low-ambiguity: a property maps to one obvious
 * place in the source. Utility-class approaches additionally let a property
 * change show up as a class-name change instead of a literal value.
 */
public enum StylingApproach {
    TAILWIND,
    CSS_MODULES,
    STYLED_COMPONENTS,
    CSS,
    SCSS,
    MIXED,
    UNKNOWN;

    public boolean isLowAmbiguity() {
        return this == TAILWIND || this == CSS_MODULES;
    }

    public boolean usesUtilityClasses() {
        return this == TAILWIND || this == MIXED;
    }

    public String displayName() {
        return name().toLowerCase().replace('_', '-');
    }
}
