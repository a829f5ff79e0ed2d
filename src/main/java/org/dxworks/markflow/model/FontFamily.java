package org.dxworks.markflow.model;

public enum FontFamily {
    SANS_SERIF,
    MONOSPACE
}
