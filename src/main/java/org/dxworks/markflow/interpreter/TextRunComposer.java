package org.dxworks.markflow.interpreter;

import org.dxworks.markflow.html.style.FontStyle;
import org.dxworks.markflow.html.style.FontWeight;
import org.dxworks.markflow.html.style.TextDecoration;
import org.dxworks.markflow.model.FontFamily;
import org.dxworks.markflow.model.Text;
import org.dxworks.markflow.model.TextBox;

/**
 * Collapses whitespace the way html does and stamps the inherited style onto
 * the resulting fragments.
 */
class TextRunComposer {
    static final float SMALL_FONT_SIZE = 12.0f;

    private final float[] textColor;
    private final float[] linkColor;
    private final float hidpiScale;

    TextRunComposer(float[] textColor, float[] linkColor, float hidpiScale) {
        this.textColor = textColor;
        this.linkColor = linkColor;
        this.hidpiScale = hidpiScale;
    }

    void compose(TextBox box, InheritedState state, String string, Flow flow) {
        TextOptions options = state.getTextOptions();

        if ("\n".equals(string)) {
            if (options.isPreFormatted()) {
                box.texts.add(plain("\n"));
            }
            pushSpaceAfterWord(box);
            return;
        }
        if (string.isBlank() && !options.isPreFormatted()) {
            pushSpaceAfterWord(box);
            return;
        }

        String content = string;
        if (box.texts.isEmpty()) {
            if (!options.isPreFormatted()) {
                content = content.stripLeading();
            }
            flow.applyPendingListItem(box);
        }

        Text text = plain(content);
        if (options.getBlockQuote() >= 1) {
            box.quoteBlock = options.getBlockQuote();
        }
        if (options.getAlign() != null) {
            box.align = options.getAlign();
        }

        if (options.isCode()) {
            Span span = state.getSpan();
            text.withColor(span.getColor()).withFamily(FontFamily.MONOSPACE);
            if (span.getWeight() == FontWeight.BOLD) {
                text.makeBold(true);
            }
            if (span.getStyle() == FontStyle.ITALIC) {
                text.makeItalic(true);
            }
            if (span.getDecoration() == TextDecoration.UNDERLINE) {
                text.makeUnderlined(true);
            }
        }
        // link colour wins over code colour
        String link = flow.takePendingLink();
        if (link != null) {
            text.withLink(link).withColor(linkColor);
        }
        if (options.isBold()) {
            text.makeBold(true);
        }
        if (options.isItalic()) {
            text.makeItalic(true);
        }
        if (options.isUnderline()) {
            text.makeUnderlined(true);
        }
        if (options.isStrikeThrough()) {
            text.makeStriked(true);
        }
        if (options.isSmall()) {
            box.fontSize = SMALL_FONT_SIZE;
        }
        box.texts.add(text);
    }

    /** Bold list marker such as {@code "3. "}. */
    Text prefix(String marker) {
        return plain(marker).makeBold(true);
    }

    private void pushSpaceAfterWord(TextBox box) {
        Text last = box.lastText();
        if (last == null || last.text.isEmpty()) {
            return;
        }
        int lastChar = last.text.codePointBefore(last.text.length());
        if (!Character.isWhitespace(lastChar)) {
            box.texts.add(plain(" "));
        }
    }

    private Text plain(String content) {
        return new Text(content, hidpiScale, textColor);
    }
}
