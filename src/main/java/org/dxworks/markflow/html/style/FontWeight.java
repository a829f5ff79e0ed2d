package org.dxworks.markflow.html.style;

public enum FontWeight {
    NORMAL,
    BOLD
}
