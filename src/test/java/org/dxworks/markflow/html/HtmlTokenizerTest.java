package org.dxworks.markflow.html;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HtmlTokenizerTest {

    @Test
    void emitsTagsTextAndEnd() {
        assertEquals(List.of(
                "open p [class=intro] false",
                "text a & b",
                "close p",
                "end"
        ), tokenize("<p class=\"intro\">a &amp; b</p>"));
    }

    @Test
    void splitsEveryNewlineIntoItsOwnToken() {
        assertEquals(List.of(
                "text one",
                "text \n",
                "text \n",
                "text two",
                "end"
        ), tokenize("one\n\r\ntwo"));
    }

    @Test
    void readsBooleanUnquotedAndSelfClosingAttributes() {
        assertEquals(List.of(
                "open input [type=checkbox, disabled=, checked=] false",
                "open ol [start=5] false",
                "open br [] true",
                "end"
        ), tokenize("<input type=\"checkbox\" disabled=\"\" checked><ol start=5><br />"));
    }

    @Test
    void skipsCommentsAndDoctypes() {
        assertEquals(List.of(
                "open p [] false",
                "text x",
                "close p",
                "end"
        ), tokenize("<!DOCTYPE html><!-- note --><p>x</p>"));
    }

    @Test
    void decodesNumericAndNamedReferences() {
        assertEquals(List.of("text AB <\"> &unknown;", "end"), tokenize("&#65;&#x42; &lt;&quot;&gt; &unknown;"));
    }

    @Test
    void decodesTheFullNamedReferenceTable() {
        assertEquals(List.of(
                "open a [title=\u00E9t\u00E9 & co] false",
                "text Caf\u00E9 \u2192 \u20AC",
                "close a",
                "end"
        ), tokenize("<a title=\"&eacute;t&eacute; &amp; co\">Caf&eacute; &rarr; &euro;</a>"));
    }

    @Test
    void strayLessThanIsTextAndAParseError() {
        assertEquals(List.of("error", "text a < b", "end"), tokenize("a < b"));
    }

    private static List<String> tokenize(String html) {
        RecordingSink sink = new RecordingSink();
        HtmlTokenizer.tokenize(html, sink);
        return sink.events;
    }

    private static class RecordingSink implements TokenSink {
        private final List<String> events = new ArrayList<>();

        @Override
        public void open(String name, List<RawAttribute> attributes, boolean selfClosing) {
            String attrs = attributes.stream()
                    .map(attribute -> attribute.name() + "=" + attribute.value())
                    .collect(Collectors.joining(", ", "[", "]"));
            events.add("open " + name + " " + attrs + " " + selfClosing);
        }

        @Override
        public void close(String name) {
            events.add("close " + name);
        }

        @Override
        public void text(String text) {
            events.add("text " + text);
        }

        @Override
        public void end() {
            events.add("end");
        }

        @Override
        public void parseError(String message) {
            events.add("error");
        }
    }
}
