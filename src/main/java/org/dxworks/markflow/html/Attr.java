package org.dxworks.markflow.html;

import org.dxworks.markflow.html.style.Style;
import org.dxworks.markflow.html.style.StyleParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Parsed form of the attributes the interpreter cares about.
 */
public sealed interface Attr permits Attr.Href, Attr.Anchor, Attr.InlineStyle, Attr.Alignment,
        Attr.IsCheckbox, Attr.IsChecked, Attr.Start {

    record Href(String link) implements Attr {
    }

    /** Named anchor, stored with its leading {@code #}. */
    record Anchor(String anchor) implements Attr {
    }

    record InlineStyle(String style) implements Attr {
    }

    record Alignment(Align align) implements Attr {
    }

    record IsCheckbox() implements Attr {
    }

    record IsChecked() implements Attr {
    }

    record Start(int start) implements Attr {
    }

    static Optional<Attr> parse(String name, String value) {
        if (name == null) {
            return Optional.empty();
        }
        String v = value == null ? "" : value;
        switch (name.toLowerCase(Locale.ROOT)) {
            case "href":
                return Optional.of(new Href(v));
            case "id":
            case "name":
                return v.isEmpty() ? Optional.empty() : Optional.of(new Anchor("#" + v));
            case "style":
                return Optional.of(new InlineStyle(v));
            case "align":
                return Align.parse(v).map(Alignment::new);
            case "type":
                return "checkbox".equalsIgnoreCase(v.trim()) ? Optional.of(new IsCheckbox()) : Optional.empty();
            case "checked":
                return Optional.of(new IsChecked());
            case "start":
                try {
                    return Optional.of(new Start(Integer.parseInt(v.trim())));
                } catch (NumberFormatException e) {
                    return Optional.empty();
                }
            default:
                return Optional.empty();
        }
    }

    static List<Attr> parseAll(List<RawAttribute> rawAttributes) {
        List<Attr> attrs = new ArrayList<>();
        if (rawAttributes == null) {
            return attrs;
        }
        for (RawAttribute raw : rawAttributes) {
            parse(raw.name(), raw.value()).ifPresent(attrs::add);
        }
        return attrs;
    }

    /**
     * Alignment from an {@code align} attribute, or else from a {@code text-align} style declaration.
     */
    static Optional<Align> findAlign(List<Attr> attrs) {
        for (Attr attr : attrs) {
            if (attr instanceof Alignment alignment) {
                return Optional.of(alignment.align());
            }
        }
        for (Style style : StyleParser.parse(findStyle(attrs).orElse(""))) {
            if (style instanceof Style.TextAlign textAlign) {
                return Optional.of(textAlign.align());
            }
        }
        return Optional.empty();
    }

    static Optional<String> findStyle(List<Attr> attrs) {
        for (Attr attr : attrs) {
            if (attr instanceof InlineStyle inlineStyle) {
                return Optional.of(inlineStyle.style());
            }
        }
        return Optional.empty();
    }
}
