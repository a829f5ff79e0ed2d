package org.dxworks.markflow.interpreter;

import org.dxworks.markflow.html.style.FontStyle;
import org.dxworks.markflow.html.style.FontWeight;
import org.dxworks.markflow.html.style.TextDecoration;

/**
 * Styling applied to code runs, overridable through {@code <span style="...">}.
 */
final class Span {
    private final float[] color;
    private final FontWeight weight;
    private final FontStyle style;
    private final TextDecoration decoration;

    Span(float[] color, FontWeight weight, FontStyle style, TextDecoration decoration) {
        this.color = color;
        this.weight = weight;
        this.style = style;
        this.decoration = decoration;
    }

    float[] getColor() {
        return color;
    }

    FontWeight getWeight() {
        return weight;
    }

    FontStyle getStyle() {
        return style;
    }

    TextDecoration getDecoration() {
        return decoration;
    }

    Span withColor(float[] color) {
        return new Span(color, weight, style, decoration);
    }

    Span withWeight(FontWeight weight) {
        return new Span(color, weight, style, decoration);
    }

    Span withStyle(FontStyle style) {
        return new Span(color, weight, style, decoration);
    }

    Span withDecoration(TextDecoration decoration) {
        return new Span(color, weight, style, decoration);
    }
}
