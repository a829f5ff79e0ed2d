package org.dxworks.markflow.html.style;

import org.dxworks.markflow.html.Align;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Splits an inline style string into {@link Style} declarations. Declarations
 * that are not understood are skipped.
 */
public final class StyleParser {

    private StyleParser() {
    }

    public static List<Style> parse(String styleString) {
        List<Style> styles = new ArrayList<>();
        if (styleString == null || styleString.isBlank()) {
            return styles;
        }

        for (String declaration : styleString.split(";")) {
            int colon = declaration.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String property = declaration.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = declaration.substring(colon + 1).trim();
            Style style = toStyle(property, value);
            if (style != null) {
                styles.add(style);
            }
        }
        return styles;
    }

    private static Style toStyle(String property, String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        switch (property) {
            case "color": {
                OptionalInt rgb = parseHexColor(value);
                return rgb.isPresent() ? new Style.Color(rgb.getAsInt()) : null;
            }
            case "background-color": {
                OptionalInt rgb = parseHexColor(value);
                return rgb.isPresent() ? new Style.BackgroundColor(rgb.getAsInt()) : null;
            }
            case "font-weight":
                return new Style.Weight(isBoldWeight(lower) ? FontWeight.BOLD : FontWeight.NORMAL);
            case "font-style":
                return new Style.Slant("italic".equals(lower) || "oblique".equals(lower)
                        ? FontStyle.ITALIC
                        : FontStyle.NORMAL);
            case "text-decoration":
                return new Style.Decoration(lower.contains("underline")
                        ? TextDecoration.UNDERLINE
                        : TextDecoration.NONE);
            case "text-align":
                return Align.parse(lower).map(Style.TextAlign::new).orElse(null);
            default:
                return null;
        }
    }

    private static boolean isBoldWeight(String value) {
        if ("bold".equals(value) || "bolder".equals(value)) {
            return true;
        }
        try {
            return Integer.parseInt(value) >= 600;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /** Accepts {@code #rgb} and {@code #rrggbb}. */
    public static OptionalInt parseHexColor(String value) {
        if (value == null) {
            return OptionalInt.empty();
        }
        String hex = value.trim();
        if (!hex.startsWith("#")) {
            return OptionalInt.empty();
        }
        hex = hex.substring(1);
        if (hex.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (char c : hex.toCharArray()) {
                expanded.append(c).append(c);
            }
            hex = expanded.toString();
        }
        if (hex.length() != 6 || !hex.chars().allMatch(StyleParser::isHexDigit)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(hex, 16));
    }

    private static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
