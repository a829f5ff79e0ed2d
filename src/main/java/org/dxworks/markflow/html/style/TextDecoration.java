package org.dxworks.markflow.html.style;

public enum TextDecoration {
    NONE,
    UNDERLINE
}
