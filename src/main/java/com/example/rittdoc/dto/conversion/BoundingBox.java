package com.example.rittdoc.dto.conversion;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BoundingBox {
    private double x;
    private double y;
    private double width;
    private double height;
    private int pageNumber;

    public double getBottom() {
        return y + height;
    }

    public static BoundingBox of(TextRun run) {
        return new BoundingBox(run.getX(), run.getY(), run.getWidth(), run.getHeight(), run.getPageNumber());
    }

    /**
     * Grows this box to cover {@code run}. Both must sit on the same page.
     */
    public void include(TextRun run) {
        double minX = Math.min(x, run.getX());
        double minY = Math.min(y, run.getY());
        double maxX = Math.max(x + width, run.getX() + run.getWidth());
        double maxY = Math.max(getBottom(), run.getBottom());
        x = minX;
        y = minY;
        width = maxX - minX;
        height = maxY - minY;
    }
}
