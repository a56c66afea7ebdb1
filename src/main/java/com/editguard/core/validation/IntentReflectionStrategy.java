package com.editguard.core.validation;

import com.editguard.core.repo.StylingApproach;
import com.editguard.core.request.PropertyEdit;

/**
 * IntentReflectionStrategy: decides whether a property edit shows up in proposed content.
 *
 * The validation engine consults every strategy that supports the component's
 * styling approach; an edit is reflected if any of them says so.
 */
public interface IntentReflectionStrategy {

    boolean supports(StylingApproach approach);

    boolean isReflected(String proposedContent, PropertyEdit edit);
}
