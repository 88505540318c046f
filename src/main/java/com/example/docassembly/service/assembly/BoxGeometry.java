package com.example.docassembly.service.assembly;

import com.example.docassembly.dto.detection.BoundingBox;

import java.util.Collection;
import java.util.Iterator;

/**
 * Pure bounding box arithmetic. Every operation requires valid boxes and throws
 * {@link IllegalArgumentException} otherwise; callers are expected to validate
 * detector output first and report it against the offending line or region.
 */
public final class BoxGeometry {

    private BoxGeometry() {
    }

    public static boolean isValid(BoundingBox box) {
        if (box == null || box.getTopLeft() == null || box.getBottomRight() == null) {
            return false;
        }
        double x0 = box.getTopLeft().getX();
        double y0 = box.getTopLeft().getY();
        double x1 = box.getBottomRight().getX();
        double y1 = box.getBottomRight().getY();
        if (!Double.isFinite(x0) || !Double.isFinite(y0) || !Double.isFinite(x1) || !Double.isFinite(y1)) {
            return false;
        }
        return x0 <= x1 && y0 <= y1;
    }

    public static BoundingBox requireValid(BoundingBox box) {
        if (!isValid(box)) {
            throw new IllegalArgumentException("bbox coordinates are invalid: " + box);
        }
        return box;
    }

    public static double area(BoundingBox box) {
        requireValid(box);
        return box.getWidth() * box.getHeight();
    }

    public static double intersectionArea(BoundingBox a, BoundingBox b) {
        requireValid(a);
        requireValid(b);

        double left = Math.max(a.getTopLeft().getX(), b.getTopLeft().getX());
        double top = Math.max(a.getTopLeft().getY(), b.getTopLeft().getY());
        double right = Math.min(a.getBottomRight().getX(), b.getBottomRight().getX());
        double bottom = Math.min(a.getBottomRight().getY(), b.getBottomRight().getY());

        double width = Math.max(0, right - left);
        double height = Math.max(0, bottom - top);
        return width * height;
    }

    public static BoundingBox union(BoundingBox a, BoundingBox b) {
        requireValid(a);
        requireValid(b);
        return BoundingBox.of(
            Math.min(a.getTopLeft().getX(), b.getTopLeft().getX()),
            Math.min(a.getTopLeft().getY(), b.getTopLeft().getY()),
            Math.max(a.getBottomRight().getX(), b.getBottomRight().getX()),
            Math.max(a.getBottomRight().getY(), b.getBottomRight().getY()));
    }

    public static BoundingBox union(Collection<BoundingBox> boxes) {
        if (boxes == null || boxes.isEmpty()) {
            throw new IllegalArgumentException("Cannot compute the union of no boxes");
        }
        Iterator<BoundingBox> it = boxes.iterator();
        BoundingBox result = copyOf(requireValid(it.next()));
        while (it.hasNext()) {
            result = union(result, it.next());
        }
        return result;
    }

    public static BoundingBox copyOf(BoundingBox box) {
        return requireValid(box).copy();
    }
}
