package com.example.docassembly.dto.detection;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Axis-aligned rectangle given by its top-left and bottom-right corners,
 * in page pixels or normalized page coordinates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {
    private Point2D topLeft;
    private Point2D bottomRight;

    public static BoundingBox of(double x0, double y0, double x1, double y1) {
        return new BoundingBox(new Point2D(x0, y0), new Point2D(x1, y1));
    }

    public BoundingBox copy() {
        return of(topLeft.getX(), topLeft.getY(), bottomRight.getX(), bottomRight.getY());
    }

    @JsonIgnore
    public double getTop() {
        return topLeft.getY();
    }

    @JsonIgnore
    public double getWidth() {
        return bottomRight.getX() - topLeft.getX();
    }

    @JsonIgnore
    public double getHeight() {
        return bottomRight.getY() - topLeft.getY();
    }
}
