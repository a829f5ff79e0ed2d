package org.dxworks.markflow.model;

public final class NativeColor {

    private NativeColor() {
    }

    /**
     * Converts a {@code 0xRRGGBB} colour into {@code [r, g, b, 1.0]} for the given surface format.
     */
    public static float[] of(int rgb, ColorFormat format) {
        return new float[]{
                channel(rgb >> 16, format),
                channel(rgb >> 8, format),
                channel(rgb, format),
                1.0f
        };
    }

    private static float channel(int value, ColorFormat format) {
        float x = (value & 0xFF) / 255.0f;
        if (!format.isSrgb()) {
            return x;
        }
        if (x > 0.04045f) {
            return (float) Math.pow((x + 0.055f) / 1.055f, 2.4f);
        }
        return x / 12.92f;
    }
}
