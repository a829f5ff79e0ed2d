package org.dxworks.markflow.html;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of the html tags the interpreter understands. Anything else is
 * reported as an unknown tag by the tree builder.
 */
public enum TagName {
    ROOT(false, null),
    ANCHOR(false, null, "a"),
    BLOCK_QUOTE(false, null, "blockquote"),
    BOLD_OR_STRONG(false, null, "b", "strong"),
    BREAK(true, null, "br"),
    CODE(false, null, "code"),
    DETAILS(false, null, "details"),
    DIV(false, null, "div"),
    EMPHASIS_OR_ITALIC(false, null, "em", "i"),
    H1(false, HeaderType.H1, "h1"),
    H2(false, HeaderType.H2, "h2"),
    H3(false, HeaderType.H3, "h3"),
    H4(false, HeaderType.H4, "h4"),
    H5(false, HeaderType.H5, "h5"),
    H6(false, HeaderType.H6, "h6"),
    HORIZONTAL_RULER(true, null, "hr"),
    IMAGE(true, null, "img"),
    INPUT(true, null, "input"),
    LIST_ITEM(false, null, "li"),
    ORDERED_LIST(false, null, "ol"),
    PARAGRAPH(false, null, "p"),
    PICTURE(false, null, "picture"),
    PREFORMATTED_TEXT(false, null, "pre"),
    SECTION(false, null, "section"),
    SMALL(false, null, "small"),
    SOURCE(true, null, "source"),
    SPAN(false, null, "span"),
    STRIKETHROUGH(false, null, "s", "del", "strike"),
    SUMMARY(false, null, "summary"),
    TABLE(false, null, "table"),
    TABLE_BODY(false, null, "tbody"),
    TABLE_DATA_CELL(false, null, "td"),
    TABLE_HEAD(false, null, "thead"),
    TABLE_HEADER(false, null, "th"),
    TABLE_ROW(false, null, "tr"),
    UNDERLINE(false, null, "u", "ins"),
    UNORDERED_LIST(false, null, "ul");

    private static final Map<String, TagName> BY_NAME = new HashMap<>();

    static {
        for (TagName tag : values()) {
            for (String name : tag.names) {
                BY_NAME.put(name, tag);
            }
        }
    }

    private final boolean isVoid;
    private final HeaderType headerType;
    private final String[] names;

    TagName(boolean isVoid, HeaderType headerType, String... names) {
        this.isVoid = isVoid;
        this.headerType = headerType;
        this.names = names;
    }

    public static Optional<TagName> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }

    /** Void tags never get content and never expect a closing tag. */
    public boolean isVoid() {
        return isVoid;
    }

    public boolean isHeader() {
        return headerType != null;
    }

    /** The header type for {@code h1}..{@code h6}, {@code null} otherwise. */
    public HeaderType getHeaderType() {
        return headerType;
    }
}
