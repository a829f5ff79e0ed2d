package org.dxworks.markflow.html;

public enum HeaderType {
    H1(2.0f),
    H2(1.5f),
    H3(1.17f),
    H4(1.0f),
    H5(0.83f),
    H6(0.67f);

    private final float sizeMultiplier;

    HeaderType(float sizeMultiplier) {
        this.sizeMultiplier = sizeMultiplier;
    }

    public float getSizeMultiplier() {
        return sizeMultiplier;
    }

    public int getLevel() {
        return ordinal() + 1;
    }
}
