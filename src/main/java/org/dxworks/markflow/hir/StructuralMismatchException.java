package org.dxworks.markflow.hir;

/**
 * A closing tag did not match the innermost open tag.
 */
public class StructuralMismatchException extends Exception {

    public StructuralMismatchException(String message) {
        super(message);
    }
}
