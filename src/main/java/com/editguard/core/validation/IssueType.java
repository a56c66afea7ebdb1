package com.editguard.core.validation;

/**
 * GENERATION_FAILED marks an attempt whose backend call produced nothing to
 * validate (transport failure or cancellation). It is kept apart from the four
 * content checks so a transport problem is never reported as a bad edit.
 */
public enum IssueType {
    SYNTAX,
    INTENT_MISMATCH,
    PRESERVATION_VIOLATION,
    SCOPE_EXCEEDED,
    GENERATION_FAILED
}
