package com.editguard.core.request;

/**
 * Category of a single property-level edit.
 *
 * The category of the first edit in a request is the request's "change type":
 * it selects the deletion and change-ratio ceilings used by the scope guard.
 */
public enum ChangeCategory {
    STYLING,
    LAYOUT,
    STRUCTURE,
    CONTENT
}
