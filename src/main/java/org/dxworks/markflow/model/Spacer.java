package org.dxworks.markflow.model;

/**
 * Vertical gap between elements. A visible spacer draws a horizontal rule.
 */
public class Spacer implements Element {
    public boolean visible;

    private Spacer(boolean visible) {
        this.visible = visible;
    }

    public static Spacer visible() {
        return new Spacer(true);
    }

    public static Spacer invisible() {
        return new Spacer(false);
    }
}
