package com.editguard.core.validation;

import com.editguard.core.repo.StylingApproach;
import com.editguard.core.request.PropertyEdit;

import org.springframework.stereotype.Component;

/** Property name (kebab or camelCase) and the new value both appear in the content. */
@Component
public class LiteralIntentReflection implements IntentReflectionStrategy {

    @Override
    public boolean supports(StylingApproach approach) {
        return true;
    }

    @Override
    public boolean isReflected(String proposedContent, PropertyEdit edit) {
        if (!proposedContent.contains(edit.getAfter())) {
            return false;
        }
        return proposedContent.contains(edit.getProperty())
                || proposedContent.contains(edit.camelCaseProperty());
    }
}
