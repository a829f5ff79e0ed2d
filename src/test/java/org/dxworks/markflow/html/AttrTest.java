package org.dxworks.markflow.html;

import org.dxworks.markflow.html.style.FontStyle;
import org.dxworks.markflow.html.style.FontWeight;
import org.dxworks.markflow.html.style.Style;
import org.dxworks.markflow.html.style.StyleParser;
import org.dxworks.markflow.html.style.TextDecoration;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttrTest {

    @Test
    void parsesRecognisedAttributes() {
        assertEquals(Optional.of(new Attr.Href("https://example.org")), Attr.parse("href", "https://example.org"));
        assertEquals(Optional.of(new Attr.Anchor("#intro")), Attr.parse("id", "intro"));
        assertEquals(Optional.of(new Attr.Anchor("#intro")), Attr.parse("name", "intro"));
        assertEquals(Optional.of(new Attr.Alignment(Align.RIGHT)), Attr.parse("align", "right"));
        assertEquals(Optional.of(new Attr.IsCheckbox()), Attr.parse("type", "checkbox"));
        assertEquals(Optional.of(new Attr.IsChecked()), Attr.parse("checked", ""));
        assertEquals(Optional.of(new Attr.Start(7)), Attr.parse("start", "7"));
    }

    @Test
    void dropsEverythingElse() {
        assertTrue(Attr.parse("class", "language-java").isEmpty());
        assertTrue(Attr.parse("type", "text").isEmpty());
        assertTrue(Attr.parse("start", "seven").isEmpty());
        assertTrue(Attr.parse("disabled", "").isEmpty());
    }

    @Test
    void alignmentComesFromAttributeBeforeStyle() {
        List<Attr> both = List.of(new Attr.InlineStyle("text-align: right"), new Attr.Alignment(Align.CENTER));
        List<Attr> styleOnly = List.of(new Attr.InlineStyle("color: #fff; text-align: right"));

        assertEquals(Optional.of(Align.CENTER), Attr.findAlign(both));
        assertEquals(Optional.of(Align.RIGHT), Attr.findAlign(styleOnly));
        assertEquals(Optional.empty(), Attr.findAlign(List.of()));
    }

    @Test
    void styleParserReadsKnownDeclarations() {
        List<Style> styles = StyleParser.parse(
                "color: #ff0000; background-color:#abc; font-weight: 700; font-style: italic; "
                        + "text-decoration: underline; margin: 0; text-align: center");

        assertEquals(List.of(
                new Style.Color(0xFF0000),
                new Style.BackgroundColor(0xAABBCC),
                new Style.Weight(FontWeight.BOLD),
                new Style.Slant(FontStyle.ITALIC),
                new Style.Decoration(TextDecoration.UNDERLINE),
                new Style.TextAlign(Align.CENTER)
        ), styles);
    }

    @Test
    void styleParserSkipsMalformedDeclarations() {
        assertEquals(List.of(new Style.Weight(FontWeight.NORMAL)),
                StyleParser.parse("color: red; nonsense; font-weight: 400;;"));
    }
}
