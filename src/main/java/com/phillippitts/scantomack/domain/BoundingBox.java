package com.phillippitts.scantomack.domain;

import java.util.Collection;

/**
 * Axis-aligned pixel rectangle, top-left (x0,y0) to bottom-right (x1,y1).
 */
public record BoundingBox(int x0, int y0, int x1, int y1) {

    public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0);

    public int width() {
        return Math.max(0, x1 - x0);
    }

    public int height() {
        return Math.max(0, y1 - y0);
    }

    public BoundingBox union(BoundingBox other) {
        if (other == null) {
            return this;
        }
        return new BoundingBox(
                Math.min(x0, other.x0),
                Math.min(y0, other.y0),
                Math.max(x1, other.x1),
                Math.max(y1, other.y1));
    }

    /**
     * Smallest box enclosing all given boxes; {@link #EMPTY} for an empty collection.
     */
    public static BoundingBox enclosing(Collection<BoundingBox> boxes) {
        BoundingBox result = null;
        for (BoundingBox box : boxes) {
            result = result == null ? box : result.union(box);
        }
        return result == null ? EMPTY : result;
    }
}
