package org.dxworks.markflow.hir;

import org.dxworks.markflow.Diagnostic;
import org.dxworks.markflow.html.TagName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arena of nodes produced by the {@link TreeBuilder}. Index 0 is always the
 * synthetic root; children are referenced by index and every referenced index
 * was appended before the reference.
 */
public class Hir {
    public static final int ROOT = 0;

    private final List<HirNode> nodes = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    Hir() {
        nodes.add(new HirNode(TagName.ROOT, List.of()));
    }

    public HirNode root() {
        return node(ROOT);
    }

    /**
     * @throws IllegalStateException when the index is outside the arena, which
     *                               only a builder defect can cause
     */
    public HirNode node(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IllegalStateException("Node index " + index + " out of range, arena holds " + nodes.size() + " nodes");
        }
        return nodes.get(index);
    }

    public int size() {
        return nodes.size();
    }

    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    int append(HirNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        dump(out, ROOT, 0);
        return out.toString();
    }

    private void dump(StringBuilder out, int index, int indent) {
        HirNode node = node(index);
        out.append(" ".repeat(indent)).append(node.getTag()).append(":\n");
        for (HirContent item : node.getContent()) {
            if (item instanceof HirContent.Text text) {
                out.append(" ".repeat(indent + 2)).append('"').append(escape(text.text())).append("\"\n");
            } else if (item instanceof HirContent.Child child) {
                dump(out, child.index(), indent + 2);
            }
        }
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\n", "\\n").replace("\"", "\\\"");
    }
}
