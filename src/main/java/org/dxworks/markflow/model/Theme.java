package org.dxworks.markflow.model;

/**
 * The colours the interpreter needs, as {@code 0xRRGGBB}.
 */
public class Theme {
    private final int textColor;
    private final int linkColor;
    private final int codeColor;

    public Theme(int textColor, int linkColor, int codeColor) {
        this.textColor = textColor;
        this.linkColor = linkColor;
        this.codeColor = codeColor;
    }

    public static Theme darkDefault() {
        return new Theme(0x9DACBB, 0x4182EB, 0xB38FAC);
    }

    public static Theme lightDefault() {
        return new Theme(0x000000, 0x5466FF, 0x95114E);
    }

    public int getTextColor() {
        return textColor;
    }

    public int getLinkColor() {
        return linkColor;
    }

    public int getCodeColor() {
        return codeColor;
    }

    public Theme withTextColor(int textColor) {
        return new Theme(textColor, linkColor, codeColor);
    }

    public Theme withLinkColor(int linkColor) {
        return new Theme(textColor, linkColor, codeColor);
    }

    public Theme withCodeColor(int codeColor) {
        return new Theme(textColor, linkColor, codeColor);
    }
}
