package com.editguard.core.validation;

import com.editguard.core.repo.StylingApproach;
import com.editguard.core.request.PropertyEdit;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Utility-class frameworks express a property change as a class swap, so the
 * literal value never appears. Any class from the property's family counts.
 *
 * The table covers the common Tailwind families only; unknown properties are
 * never reflected here and fall back to the literal check.
 */
@Component
public class UtilityClassIntentReflection implements IntentReflectionStrategy {

    private static final Map<String, List<String>> CLASS_FAMILIES = Map.of(
            "font-size",        List.of("text-xs", "text-sm", "text-base", "text-lg", "text-xl", "text-2xl"),
            "color",            List.of("text-red", "text-blue", "text-green", "text-gray"),
            "background-color", List.of("bg-red", "bg-blue", "bg-green", "bg-gray")
    );

    @Override
    public boolean supports(StylingApproach approach) {
        return approach.usesUtilityClasses();
    }

    @Override
    public boolean isReflected(String proposedContent, PropertyEdit edit) {
        List<String> family = CLASS_FAMILIES.getOrDefault(edit.getProperty().toLowerCase(), List.of());
        return family.stream().anyMatch(proposedContent::contains);
    }
}
