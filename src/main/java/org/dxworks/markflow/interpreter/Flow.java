package org.dxworks.markflow.interpreter;

import org.dxworks.markflow.model.Element;
import org.dxworks.markflow.model.Spacer;
import org.dxworks.markflow.model.Text;
import org.dxworks.markflow.model.TextBox;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable part of one traversal: the output so far, the box being filled, a
 * link waiting for the next text run and the marker or checkbox of a list item
 * waiting for its first visible text. Never shared between threads.
 */
class Flow {
    private final List<Element> output = new ArrayList<>();
    private final float hidpiScale;
    private TextBox current;
    private String pendingLink;
    private Text pendingListPrefix;
    private Boolean pendingCheckbox;

    Flow(float hidpiScale) {
        this.hidpiScale = hidpiScale;
        this.current = new TextBox(hidpiScale);
    }

    TextBox current() {
        return current;
    }

    /**
     * Starts a fresh box and emits the previous one if it has any visible text.
     */
    void pushTextBox(InheritedState state) {
        TextBox finished = current;
        current = new TextBox(hidpiScale);
        current.indent = state.getGlobalIndent();

        if (finished.hasContent()) {
            finished.indent = state.getGlobalIndent();
            output.add(finished);
        }
    }

    void pushSpacer() {
        output.add(Spacer.invisible());
    }

    void pushElement(Element element) {
        output.add(element);
    }

    void setPendingLink(String link) {
        this.pendingLink = link;
    }

    String takePendingLink() {
        String link = pendingLink;
        pendingLink = null;
        return link;
    }

    void setPendingListPrefix(Text prefix) {
        this.pendingListPrefix = prefix;
        this.pendingCheckbox = null;
    }

    /**
     * A checkbox opening a list item takes the place of its marker.
     */
    void setPendingCheckbox(boolean checked) {
        this.pendingListPrefix = null;
        this.pendingCheckbox = checked;
    }

    boolean hasPendingListItem() {
        return pendingListPrefix != null || pendingCheckbox != null;
    }

    /**
     * Puts the waiting marker or checkbox onto {@code box} and clears it.
     */
    void applyPendingListItem(TextBox box) {
        if (pendingCheckbox != null) {
            box.checkbox = pendingCheckbox;
        } else if (pendingListPrefix != null) {
            box.texts.add(pendingListPrefix);
        }
        pendingListPrefix = null;
        pendingCheckbox = null;
    }

    List<Element> output() {
        return output;
    }
}
