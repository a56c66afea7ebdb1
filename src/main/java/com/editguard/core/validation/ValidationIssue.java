package com.editguard.core.validation;

import java.util.Optional;

public class ValidationIssue {

    private final IssueType type;
    private final Severity  severity;
    private final String    message;
    private final String    suggestion;   // nullable

    public ValidationIssue(IssueType type, Severity severity, String message, String suggestion) {
        this.type       = type;
        this.severity   = severity;
        this.message    = message != null ? message : "";
        this.suggestion = suggestion;
    }

    public static ValidationIssue error(IssueType type, String message, String suggestion) {
        return new ValidationIssue(type, Severity.ERROR, message, suggestion);
    }

    public static ValidationIssue info(IssueType type, String message) {
        return new ValidationIssue(type, Severity.INFO, message, null);
    }

    public IssueType        getType()       { return type; }
    public Severity         getSeverity()   { return severity; }
    public String           getMessage()    { return message; }
    public Optional<String> getSuggestion() { return Optional.ofNullable(suggestion); }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return String.format("[%s/%s] %s", severity, type, message);
    }
}
