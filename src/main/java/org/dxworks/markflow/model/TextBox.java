package org.dxworks.markflow.model;

import org.dxworks.markflow.html.Align;

import java.util.ArrayList;
import java.util.List;

/**
 * Fragments that are laid out together, plus the box-level properties that
 * apply to all of them.
 */
public class TextBox implements Element {
    public static final float DEFAULT_FONT_SIZE = 16.0f;

    public List<Text> texts = new ArrayList<>();
    public float fontSize = DEFAULT_FONT_SIZE;
    public float indent;
    public Align align = Align.LEFT;
    public float[] backgroundColor; // nullable
    public String anchor; // nullable
    public Boolean checkbox; // null unless the box is a task list item, then the checked state
    public boolean codeBlock;
    public int quoteBlock; // nesting depth, 0 outside of block quotes
    public float hidpiScale;

    public TextBox(float hidpiScale) {
        this.hidpiScale = hidpiScale;
    }

    /** True when at least one fragment carries non-empty text. */
    public boolean hasContent() {
        for (Text text : texts) {
            if (!text.text.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /** Concatenation of every fragment's text. */
    public String plainText() {
        StringBuilder builder = new StringBuilder();
        for (Text text : texts) {
            builder.append(text.text);
        }
        return builder.toString();
    }

    public Text lastText() {
        return texts.isEmpty() ? null : texts.get(texts.size() - 1);
    }
}
