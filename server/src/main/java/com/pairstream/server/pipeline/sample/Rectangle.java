package com.pairstream.server.pipeline.sample;

import java.util.Objects;

/**
 * Axis-aligned pixel rectangle. The bottom-right corner is exclusive, so a rectangle from
 * (0, 0) to (64, 32) covers 64 columns and 32 rows.
 * <p>
 * Instances are not validated on construction; {@link #isValid()} is checked when the
 * rectangle is used for cropping.
 */
public final class Rectangle {

    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public Rectangle(int x1, int y1, int x2, int y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public int getX1() {
        return x1;
    }

    public int getY1() {
        return y1;
    }

    public int getX2() {
        return x2;
    }

    public int getY2() {
        return y2;
    }

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    public boolean isValid() {
        return x1 < x2 && y1 < y2;
    }

    public boolean fitsWithin(int imageWidth, int imageHeight) {
        return x1 >= 0 && y1 >= 0 && x2 <= imageWidth && y2 <= imageHeight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rectangle)) {
            return false;
        }
        Rectangle other = (Rectangle) o;
        return x1 == other.x1 && y1 == other.y1 && x2 == other.x2 && y2 == other.y2;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x1, y1, x2, y2);
    }

    @Override
    public String toString() {
        return "((" + x1 + ", " + y1 + "), (" + x2 + ", " + y2 + "))";
    }
}
