package org.dxworks.markflow.interpreter;

import org.dxworks.markflow.html.Align;

/**
 * Inline toggles collected on the way down. The {@code with} methods return
 * modified copies.
 */
final class TextOptions {

    static final TextOptions DEFAULT = new TextOptions();

    private boolean underline;
    private boolean bold;
    private boolean italic;
    private boolean strikeThrough;
    private boolean small;
    private boolean code;
    private boolean preFormatted;
    private int blockQuote;
    private Align align;

    private TextOptions() {
    }

    private TextOptions copy() {
        TextOptions copy = new TextOptions();
        copy.underline = underline;
        copy.bold = bold;
        copy.italic = italic;
        copy.strikeThrough = strikeThrough;
        copy.small = small;
        copy.code = code;
        copy.preFormatted = preFormatted;
        copy.blockQuote = blockQuote;
        copy.align = align;
        return copy;
    }

    boolean isUnderline() {
        return underline;
    }

    boolean isBold() {
        return bold;
    }

    boolean isItalic() {
        return italic;
    }

    boolean isStrikeThrough() {
        return strikeThrough;
    }

    boolean isSmall() {
        return small;
    }

    boolean isCode() {
        return code;
    }

    boolean isPreFormatted() {
        return preFormatted;
    }

    int getBlockQuote() {
        return blockQuote;
    }

    Align getAlign() {
        return align;
    }

    TextOptions withUnderline() {
        TextOptions copy = copy();
        copy.underline = true;
        return copy;
    }

    TextOptions withBold() {
        TextOptions copy = copy();
        copy.bold = true;
        return copy;
    }

    TextOptions withItalic() {
        TextOptions copy = copy();
        copy.italic = true;
        return copy;
    }

    TextOptions withStrikeThrough() {
        TextOptions copy = copy();
        copy.strikeThrough = true;
        return copy;
    }

    TextOptions withSmall() {
        TextOptions copy = copy();
        copy.small = true;
        return copy;
    }

    TextOptions withCode() {
        TextOptions copy = copy();
        copy.code = true;
        return copy;
    }

    TextOptions withPreFormatted() {
        TextOptions copy = copy();
        copy.preFormatted = true;
        return copy;
    }

    TextOptions withNestedBlockQuote() {
        TextOptions copy = copy();
        copy.blockQuote = blockQuote + 1;
        return copy;
    }

    TextOptions withAlign(Align align) {
        TextOptions copy = copy();
        copy.align = align;
        return copy;
    }
}
