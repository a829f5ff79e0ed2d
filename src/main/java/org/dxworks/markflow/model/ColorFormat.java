package org.dxworks.markflow.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Surface colour formats the renderer may present to. sRGB formats expect
 * linear colour values.
 */
public enum ColorFormat {
    BGRA8_UNORM_SRGB(true),
    RGBA8_UNORM_SRGB(true),
    BGRA8_UNORM(false),
    RGBA8_UNORM(false);

    private final boolean srgb;

    ColorFormat(boolean srgb) {
        this.srgb = srgb;
    }

    public boolean isSrgb() {
        return srgb;
    }

    /** Accepts both {@code bgra8-unorm-srgb} and {@code BGRA8_UNORM_SRGB}. */
    public static Optional<ColorFormat> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ColorFormat format : values()) {
            if (format.name().equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
