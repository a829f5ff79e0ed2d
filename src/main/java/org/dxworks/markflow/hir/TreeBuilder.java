package org.dxworks.markflow.hir;

import org.dxworks.markflow.Diagnostic;
import org.dxworks.markflow.DiagnosticKind;
import org.dxworks.markflow.html.Attr;
import org.dxworks.markflow.html.HtmlTokenizer;
import org.dxworks.markflow.html.RawAttribute;
import org.dxworks.markflow.html.TagName;
import org.dxworks.markflow.html.TokenSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link Hir} from a token stream. The parent stack only exists while
 * building; nodes never point back to their parent.
 */
public class TreeBuilder implements TokenSink {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    private final Hir hir = new Hir();
    private final Deque<Integer> parents = new ArrayDeque<>();
    private final Deque<TagName> toClose = new ArrayDeque<>();

    public TreeBuilder() {
        parents.push(Hir.ROOT);
        toClose.push(TagName.ROOT);
    }

    public static Hir fromHtml(String html) {
        TreeBuilder builder = new TreeBuilder();
        HtmlTokenizer.tokenize(html, builder);
        return builder.tree();
    }

    public Hir tree() {
        return hir;
    }

    @Override
    public void open(String name, List<RawAttribute> attributes, boolean selfClosing) {
        Optional<TagName> tagName = TagName.fromName(name);
        if (tagName.isEmpty()) {
            logger.info("Missing implementation for start tag: {}", name);
            hir.report(new Diagnostic(DiagnosticKind.UNKNOWN_TAG, "Unknown start tag: " + name));
            return;
        }
        TagName tag = tagName.get();

        int index = hir.append(new HirNode(tag, Attr.parseAll(attributes)));
        currentNode().addContent(new HirContent.Child(index));

        if (selfClosing || tag.isVoid()) {
            return;
        }
        parents.push(index);
        toClose.push(tag);
    }

    @Override
    public void close(String name) {
        try {
            processEndTag(name);
        } catch (StructuralMismatchException e) {
            logger.error(e.getMessage());
            hir.report(new Diagnostic(DiagnosticKind.STRUCTURAL_MISMATCH, e.getMessage()));
        }
    }

    private void processEndTag(String name) throws StructuralMismatchException {
        TagName tag = TagName.fromName(name)
                .orElseThrow(() -> new StructuralMismatchException("Missing implementation for end tag: " + name));
        if (tag.isVoid()) {
            return;
        }
        if (toClose.size() == 1) {
            throw new StructuralMismatchException("Found closing " + tag + " tag but no tag is open");
        }

        TagName expected = toClose.pop();
        // popped even on mismatch so the rest of the document still lands somewhere sensible
        parents.pop();
        if (expected != tag) {
            throw new StructuralMismatchException("Expected closing " + expected + " tag but found " + tag);
        }
    }

    @Override
    public void text(String text) {
        HirNode current = currentNode();
        if ("\n".equals(text) && current.getContent().isEmpty()) {
            return;
        }
        current.addContent(new HirContent.Text(text));
    }

    @Override
    public void end() {
        toClose.stream()
                .filter(tag -> tag != TagName.ROOT)
                .forEach(tag -> {
                    logger.warn("File contains unclosed html tag: {}", tag);
                    hir.report(new Diagnostic(DiagnosticKind.UNCLOSED_TAG, "Unclosed tag: " + tag));
                });
    }

    @Override
    public void parseError(String message) {
        logger.warn("HTML tokenizer emitted error: {}", message);
        hir.report(new Diagnostic(DiagnosticKind.PARSE_ERROR, message));
    }

    private HirNode currentNode() {
        return hir.node(parents.peek());
    }
}
