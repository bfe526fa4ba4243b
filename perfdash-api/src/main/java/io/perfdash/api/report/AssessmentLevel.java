package io.perfdash.api.report;

public enum AssessmentLevel {
    GOOD,
    NORMAL,
    HIGH
}
