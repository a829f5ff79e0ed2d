package org.dxworks.markflow.interpreter;

import org.dxworks.markflow.hir.Hir;
import org.dxworks.markflow.hir.HirContent;
import org.dxworks.markflow.hir.HirNode;
import org.dxworks.markflow.html.Attr;
import org.dxworks.markflow.html.TagName;

/**
 * Walks {@code <ol>} and {@code <ul>} subtrees. Each item gets its own box,
 * led by a bold marker or a checkbox. The marker waits in the {@link Flow}
 * until the item's first visible text, so items wrapped in paragraphs keep it
 * on the same line.
 */
class ListInterpreter {
    private static final String BULLET = "\u00B7 ";

    private final FlowInterpreter interpreter;
    private final TextRunComposer composer;

    ListInterpreter(FlowInterpreter interpreter, TextRunComposer composer) {
        this.interpreter = interpreter;
        this.composer = composer;
    }

    void process(Hir hir, Flow flow, InheritedState state, HirNode list) {
        boolean ordered = list.getTag() == TagName.ORDERED_LIST;
        // an outer item with no text of its own keeps its marker on its own line
        flow.applyPendingListItem(flow.current());
        flow.pushTextBox(state);

        InheritedState listState = state.withIndent(FlowInterpreter.HALF_MARGIN);
        long index = ordered ? startIndex(list) : 0;

        for (HirContent item : list.getContent()) {
            if (item instanceof HirContent.Text text) {
                if (!text.text().isBlank()) {
                    interpreter.misplaced("Text can only be inside list items: \"" + text.text().strip() + "\"");
                }
                continue;
            }
            HirNode child = hir.node(((HirContent.Child) item).index());
            if (child.getTag() != TagName.LIST_ITEM) {
                interpreter.misplaced("Only list items can be in a list, found " + child.getTag());
                continue;
            }
            processItem(hir, flow, listState, child, ordered ? Long.valueOf(index++) : null);
        }

        flow.pushTextBox(listState);
        if (listState.getGlobalIndent() == FlowInterpreter.HALF_MARGIN) {
            flow.pushSpacer();
        }
    }

    private void processItem(Hir hir, Flow flow, InheritedState state, HirNode item, Long number) {
        flow.pushTextBox(state);

        String marker = number != null ? number + ". " : BULLET;
        flow.setPendingListPrefix(composer.prefix(marker));

        interpreter.processContent(hir, flow, state, item.getContent());
        // an empty item still shows its marker
        flow.applyPendingListItem(flow.current());
        flow.pushTextBox(state);
    }

    private static int startIndex(HirNode list) {
        for (Attr attr : list.getAttributes()) {
            if (attr instanceof Attr.Start start) {
                return start.start();
            }
        }
        return 1;
    }
}
