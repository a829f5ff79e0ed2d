package org.dxworks.markflow;

public enum DiagnosticKind {
    STRUCTURAL_MISMATCH,
    UNCLOSED_TAG,
    UNKNOWN_TAG,
    UNSUPPORTED_FEATURE,
    MISPLACED_TAG,
    PARSE_ERROR
}
