package org.dxworks.markflow.html.style;

import org.dxworks.markflow.html.Align;

/**
 * One recognised declaration of an inline {@code style} attribute.
 */
public sealed interface Style permits Style.Color, Style.BackgroundColor, Style.Weight,
        Style.Slant, Style.Decoration, Style.TextAlign {

    record Color(int rgb) implements Style {
    }

    record BackgroundColor(int rgb) implements Style {
    }

    record Weight(FontWeight weight) implements Style {
    }

    record Slant(FontStyle style) implements Style {
    }

    record Decoration(TextDecoration decoration) implements Style {
    }

    record TextAlign(Align align) implements Style {
    }
}
