package org.dxworks.markflow;

/**
 * A recovered problem met while building or interpreting a document.
 */
public record Diagnostic(DiagnosticKind kind, String message) {

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
