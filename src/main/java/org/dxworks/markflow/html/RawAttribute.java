package org.dxworks.markflow.html;

/**
 * Attribute exactly as the tokenizer saw it. Boolean attributes carry an empty value.
 */
public record RawAttribute(String name, String value) {
}
