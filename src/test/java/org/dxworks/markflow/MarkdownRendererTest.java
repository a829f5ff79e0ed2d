package org.dxworks.markflow;

import org.dxworks.markflow.html.Align;
import org.dxworks.markflow.model.Element;
import org.dxworks.markflow.model.Table;
import org.dxworks.markflow.model.TextBox;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownRendererTest {

    private final MarkdownRenderer renderer = new MarkdownRenderer(TestUtils.CONFIG);

    @Test
    void taskListItemsBecomeCheckboxes() {
        List<Element> elements = renderer.render("- [x] done\n- [ ] todo\n").elements();

        TextBox done = (TextBox) elements.get(0);
        TextBox todo = (TextBox) elements.get(1);
        assertEquals(Boolean.TRUE, done.checkbox);
        assertEquals("done", done.plainText());
        assertEquals(Boolean.FALSE, todo.checkbox);
        assertEquals("todo", todo.plainText());
    }

    @Test
    void looseTaskListKeepsCheckboxes() {
        List<TextBox> boxes = textBoxes(renderer.render("- [x] done\n\n- [ ] todo\n").elements());

        assertEquals(2, boxes.size());
        assertEquals(Boolean.TRUE, boxes.get(0).checkbox);
        assertEquals("done", boxes.get(0).plainText());
        assertEquals(Boolean.FALSE, boxes.get(1).checkbox);
        assertEquals("todo", boxes.get(1).plainText());
    }

    @Test
    void looseOrderedListKeepsMarkersOnTheSameLine() {
        RenderedDocument document = renderer.render("1. first\n\n2. second\n");

        List<TextBox> boxes = textBoxes(document.elements());
        assertEquals(List.of("1. first", "2. second"), boxes.stream().map(TextBox::plainText).toList());
        assertTrue(document.diagnostics().isEmpty());
    }

    @Test
    void namedCharacterReferencesInRawHtmlAreDecoded() {
        TextBox box = (TextBox) renderer.render("<p>Caf&eacute; &rarr; &euro;</p>\n").elements().get(0);

        assertEquals("Caf\u00E9 \u2192 \u20AC", box.plainText());
    }

    @Test
    void gfmTableKeepsColumnAlignment() {
        RenderedDocument document = renderer.render("| a | b |\n|---|:-:|\n| 1 | 2 |\n");

        Table table = assertInstanceOf(Table.class, document.elements().get(1));
        assertEquals(2, table.rows.size());
        assertTrue(table.rows.get(0).get(0).texts.get(0).bold);
        assertEquals(Align.CENTER, table.rows.get(0).get(1).align);
        assertEquals(Align.CENTER, table.rows.get(1).get(1).align);
        assertEquals("2", table.rows.get(1).get(1).plainText());
        assertTrue(document.diagnostics().isEmpty());
    }

    @Test
    void orderedListKeepsItsStartNumber() {
        List<Element> elements = renderer.render("5. a\n6. b\n").elements();

        assertEquals("5. a", ((TextBox) elements.get(0)).plainText());
        assertEquals("6. b", ((TextBox) elements.get(1)).plainText());
    }

    @Test
    void strikethroughAndLinksAreStyled() {
        TextBox box = (TextBox) renderer.render("~~gone~~ and [site](https://example.org)\n").elements().get(0);

        assertTrue(box.texts.get(0).striked);
        assertEquals("site", box.texts.get(box.texts.size() - 1).text);
        assertEquals("https://example.org", box.texts.get(box.texts.size() - 1).link);
    }

    @Test
    void fencedCodeBlockBecomesACodeBox() {
        TextBox code = (TextBox) renderer.render("```java\nint x;\nint y;\n```\n").elements().get(0);

        assertTrue(code.codeBlock);
        assertEquals("int x;\nint y;\n", code.plainText());
    }

    @Test
    void frontMatterIsNotRendered() {
        List<Element> elements = renderer.render("---\ntitle: Doc\n---\n\n# Hello\n").elements();

        TextBox heading = (TextBox) elements.get(1);
        assertEquals("Hello", heading.plainText());
        assertEquals("#hello", heading.anchor);
        assertEquals(3, elements.size());
    }

    @Test
    void wellFormedDocumentRendersWithoutProblems() {
        String markdown = String.join("\n",
                "# Guide",
                "",
                "Some *emphasis*, **strength** and `code`.",
                "A soft break continues the paragraph.",
                "",
                "> quoted",
                "> > nested",
                "",
                "1. first",
                "2. second",
                "   - inner",
                "",
                "---",
                "",
                "## Guide",
                "");

        RenderedDocument sequential = renderer.render(markdown);
        RenderedDocument parallel = renderer.render(markdown, true);

        assertTrue(sequential.diagnostics().isEmpty(), sequential.diagnostics().toString());
        assertEquals(sequential.elements().size(), parallel.elements().size());
        List<String> anchors = sequential.elements().stream()
                .filter(TextBox.class::isInstance)
                .map(element -> ((TextBox) element).anchor)
                .filter(anchor -> anchor != null)
                .toList();
        assertEquals(List.of("#guide", "#guide-1"), anchors);
    }

    private static List<TextBox> textBoxes(List<Element> elements) {
        return elements.stream().filter(TextBox.class::isInstance).map(TextBox.class::cast).toList();
    }
}
