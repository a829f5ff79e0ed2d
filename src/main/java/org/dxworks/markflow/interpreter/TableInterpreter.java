package org.dxworks.markflow.interpreter;

import org.dxworks.markflow.hir.Hir;
import org.dxworks.markflow.hir.HirContent;
import org.dxworks.markflow.hir.HirNode;
import org.dxworks.markflow.html.Align;
import org.dxworks.markflow.html.Attr;
import org.dxworks.markflow.html.TagName;
import org.dxworks.markflow.model.Table;
import org.dxworks.markflow.model.TextBox;

import java.util.List;

/**
 * Walks a {@code <table>} subtree into a single {@link Table} element.
 */
class TableInterpreter {

    private final FlowInterpreter interpreter;
    private final TextRunComposer composer;
    private final float hidpiScale;

    TableInterpreter(FlowInterpreter interpreter, TextRunComposer composer, float hidpiScale) {
        this.interpreter = interpreter;
        this.composer = composer;
        this.hidpiScale = hidpiScale;
    }

    void process(Hir hir, Flow flow, InheritedState state, HirNode tableNode) {
        // a list marker never moves into a cell
        flow.applyPendingListItem(flow.current());
        flow.pushTextBox(state);
        flow.pushSpacer();

        Table table = new Table();
        walk(hir, flow, state, table, tableNode.getContent());

        flow.pushElement(table);
        flow.pushSpacer();
    }

    private void walk(Hir hir, Flow flow, InheritedState state, Table table, List<HirContent> content) {
        for (HirContent item : content) {
            if (item instanceof HirContent.Text text) {
                if (!text.text().isBlank()) {
                    interpreter.misplaced("Text can only be inside table cells: \"" + text.text().strip() + "\"");
                }
                continue;
            }
            HirNode child = hir.node(((HirContent.Child) item).index());
            switch (child.getTag()) {
                case TABLE_HEAD:
                case TABLE_BODY:
                    walk(hir, flow, state, table, child.getContent());
                    break;
                case TABLE_ROW:
                    table.pushRow();
                    walk(hir, flow, state, table, child.getContent());
                    break;
                case TABLE_HEADER:
                    table.pushCell(cell(hir, flow, state, child, true));
                    break;
                case TABLE_DATA_CELL:
                    table.pushCell(cell(hir, flow, state, child, false));
                    break;
                default:
                    interpreter.misplaced(child.getTag() + " can not be a direct part of a table");
            }
        }
    }

    private TextBox cell(Hir hir, Flow flow, InheritedState state, HirNode cellNode, boolean header) {
        InheritedState cellState = state.withAlign(Attr.findAlign(cellNode.getAttributes()));
        if (header) {
            cellState = cellState.withOptions(TextOptions::withBold);
        }

        TextBox box = new TextBox(hidpiScale);
        box.indent = state.getGlobalIndent();
        Align align = cellState.getTextOptions().getAlign();
        if (align != null) {
            box.align = align;
        }

        for (HirContent item : cellNode.getContent()) {
            if (item instanceof HirContent.Text text) {
                composer.compose(box, cellState, text.text(), flow);
            } else if (item instanceof HirContent.Child child) {
                interpreter.unsupported("Rich content in table cells (" + hir.node(child.index()).getTag() + ")");
            }
        }
        return box;
    }
}
