package org.dxworks.markflow.html;

import org.jsoup.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal html tokenizer for the markup commonmark produces. It does no tree
 * construction of its own: tags, text and end-of-stream are handed to a
 * {@link TokenSink} in document order. Every newline is delivered as a text
 * token of its own. Character references are resolved by jsoup.
 */
public class HtmlTokenizer {

    private final String html;
    private final TokenSink sink;
    private final StringBuilder text = new StringBuilder();
    private int pos = 0;

    private HtmlTokenizer(String html, TokenSink sink) {
        this.html = html == null ? "" : html;
        this.sink = sink;
    }

    public static void tokenize(String html, TokenSink sink) {
        new HtmlTokenizer(html, sink).run();
    }

    private void run() {
        while (pos < html.length()) {
            char c = html.charAt(pos);
            if (c == '<') {
                readMarkup();
            } else if (c == '\r') {
                // \r\n and lone \r both count as one newline
                pos++;
                if (pos < html.length() && html.charAt(pos) == '\n') {
                    pos++;
                }
                emitNewline();
            } else if (c == '\n') {
                pos++;
                emitNewline();
            } else {
                text.append(c);
                pos++;
            }
        }
        flushText();
        sink.end();
    }

    private void readMarkup() {
        if (html.startsWith("<!--", pos)) {
            flushText();
            int end = html.indexOf("-->", pos + 4);
            if (end < 0) {
                sink.parseError("Unterminated comment at offset " + pos);
                pos = html.length();
            } else {
                pos = end + 3;
            }
            return;
        }
        if (html.startsWith("<!", pos) || html.startsWith("<?", pos)) {
            flushText();
            skipPast('>');
            return;
        }
        if (html.startsWith("</", pos) && pos + 2 < html.length() && Character.isLetter(html.charAt(pos + 2))) {
            flushText();
            pos += 2;
            String name = readName();
            skipPast('>');
            sink.close(name);
            return;
        }
        if (pos + 1 < html.length() && Character.isLetter(html.charAt(pos + 1))) {
            flushText();
            pos++;
            readStartTag();
            return;
        }
        sink.parseError("Unexpected '<' at offset " + pos);
        text.append('<');
        pos++;
    }

    private void readStartTag() {
        String name = readName();
        List<RawAttribute> attributes = new ArrayList<>();
        boolean selfClosing = false;

        while (true) {
            skipWhitespace();
            if (pos >= html.length()) {
                sink.parseError("Unterminated tag <" + name + ">");
                break;
            }
            char c = html.charAt(pos);
            if (c == '>') {
                pos++;
                break;
            }
            if (c == '/') {
                pos++;
                if (pos < html.length() && html.charAt(pos) == '>') {
                    selfClosing = true;
                    pos++;
                    break;
                }
                continue;
            }
            attributes.add(readAttribute());
        }
        sink.open(name, attributes, selfClosing);
    }

    private RawAttribute readAttribute() {
        int start = pos;
        while (pos < html.length()) {
            char c = html.charAt(pos);
            if (Character.isWhitespace(c) || c == '=' || c == '>' || c == '/') {
                break;
            }
            pos++;
        }
        if (start == pos) {
            // never loop on a character that cannot start an attribute
            pos++;
        }
        String name = html.substring(start, pos);
        skipWhitespace();
        if (pos >= html.length() || html.charAt(pos) != '=') {
            return new RawAttribute(name, "");
        }
        pos++;
        skipWhitespace();
        return new RawAttribute(name, readAttributeValue());
    }

    private String readAttributeValue() {
        if (pos >= html.length()) {
            return "";
        }
        StringBuilder value = new StringBuilder();
        char quote = html.charAt(pos);
        if (quote == '"' || quote == '\'') {
            pos++;
            while (pos < html.length() && html.charAt(pos) != quote) {
                appendValueChar(value);
            }
            pos++;
        } else {
            while (pos < html.length()) {
                char c = html.charAt(pos);
                if (Character.isWhitespace(c) || c == '>') {
                    break;
                }
                appendValueChar(value);
            }
        }
        return Parser.unescapeEntities(value.toString(), true);
    }

    private void appendValueChar(StringBuilder value) {
        value.append(html.charAt(pos));
        pos++;
    }

    private String readName() {
        int start = pos;
        while (pos < html.length()) {
            char c = html.charAt(pos);
            if (Character.isWhitespace(c) || c == '>' || c == '/') {
                break;
            }
            pos++;
        }
        return html.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < html.length() && Character.isWhitespace(html.charAt(pos))) {
            pos++;
        }
    }

    private void skipPast(char c) {
        int end = html.indexOf(c, pos);
        pos = end < 0 ? html.length() : end + 1;
    }

    private void emitNewline() {
        flushText();
        sink.text("\n");
    }

    private void flushText() {
        if (text.length() > 0) {
            sink.text(Parser.unescapeEntities(text.toString(), false));
            text.setLength(0);
        }
    }
}
