package org.dxworks.markflow.interpreter;

import org.dxworks.markflow.html.Align;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Formatting that cascades down the tree. Every change yields a new instance,
 * so siblings never see each other's formatting.
 */
final class InheritedState {
    private final float globalIndent;
    private final TextOptions textOptions;
    private final Span span;

    InheritedState(float globalIndent, TextOptions textOptions, Span span) {
        this.globalIndent = globalIndent;
        this.textOptions = textOptions;
        this.span = span;
    }

    float getGlobalIndent() {
        return globalIndent;
    }

    TextOptions getTextOptions() {
        return textOptions;
    }

    Span getSpan() {
        return span;
    }

    InheritedState withIndent(float delta) {
        return new InheritedState(globalIndent + delta, textOptions, span);
    }

    InheritedState withOptions(UnaryOperator<TextOptions> change) {
        return new InheritedState(globalIndent, change.apply(textOptions), span);
    }

    InheritedState withSpan(Span span) {
        return new InheritedState(globalIndent, textOptions, span);
    }

    /** Keeps the inherited alignment when none is given. */
    InheritedState withAlign(Optional<Align> align) {
        if (align.isEmpty()) {
            return this;
        }
        return withOptions(options -> options.withAlign(align.get()));
    }
}
