package org.dxworks.markflow;

import org.dxworks.markflow.model.Element;

import java.util.List;

/**
 * Output elements of one document together with every problem recovered from
 * while producing them.
 */
public record RenderedDocument(List<Element> elements, List<Diagnostic> diagnostics) {
}
