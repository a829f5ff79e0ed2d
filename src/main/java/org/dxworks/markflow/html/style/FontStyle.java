package org.dxworks.markflow.html.style;

public enum FontStyle {
    NORMAL,
    ITALIC
}
