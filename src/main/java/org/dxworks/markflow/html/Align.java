package org.dxworks.markflow.html;

import java.util.Locale;
import java.util.Optional;

public enum Align {
    LEFT,
    CENTER,
    RIGHT;

    public static Optional<Align> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "left":
            case "start":
                return Optional.of(LEFT);
            case "center":
            case "middle":
                return Optional.of(CENTER);
            case "right":
            case "end":
                return Optional.of(RIGHT);
            default:
                return Optional.empty();
        }
    }
}
