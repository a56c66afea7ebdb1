package com.editguard.core.validation;

/** Only ERROR blocks a result. WARNING and INFO are reported and never fail validation. */
public enum Severity {
    ERROR,
    WARNING,
    INFO
}
