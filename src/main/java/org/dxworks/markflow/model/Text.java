package org.dxworks.markflow.model;

/**
 * A run of text sharing one resolved style.
 */
public class Text {
    public static final float DEFAULT_SIZE = 16.0f;

    public String text;
    public float size = DEFAULT_SIZE;
    public float[] color;
    public String link; // nullable
    public boolean bold;
    public boolean italic;
    public boolean underlined;
    public boolean striked;
    public FontFamily family = FontFamily.SANS_SERIF;
    public float hidpiScale;

    public Text(String text, float hidpiScale, float[] color) {
        this.text = text;
        this.hidpiScale = hidpiScale;
        this.color = color;
    }

    public Text withColor(float[] color) {
        this.color = color;
        return this;
    }

    public Text withLink(String link) {
        this.link = link;
        return this;
    }

    public Text withFamily(FontFamily family) {
        this.family = family;
        return this;
    }

    public Text makeBold(boolean bold) {
        this.bold = bold;
        return this;
    }

    public Text makeItalic(boolean italic) {
        this.italic = italic;
        return this;
    }

    public Text makeUnderlined(boolean underlined) {
        this.underlined = underlined;
        return this;
    }

    public Text makeStriked(boolean striked) {
        this.striked = striked;
        return this;
    }
}
