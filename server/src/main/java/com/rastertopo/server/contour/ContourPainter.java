package com.rastertopo.server.contour;

import com.rastertopo.server.image.GridPoint;
import com.rastertopo.server.image.PixelGrid;

import java.util.List;

public final class ContourPainter {

    private ContourPainter() {
    }

    public static void drawContours(PixelGrid<Integer> canvas, List<List<GridPoint>> contours, int value) {
        for (List<GridPoint> contour : contours) {
            for (GridPoint point : contour) {
                canvas.set(point.getRow(), point.getCol(), value);
            }
        }
    }

    public static void drawContours(PixelGrid<Integer> canvas, Contour root, int value) {
        for (Contour contour : root.descendants()) {
            for (GridPoint point : contour.getPoints()) {
                canvas.set(point.getRow(), point.getCol(), value);
            }
        }
    }

    /** Fresh {@code height x width} canvas with 1 on every contour point. */
    public static PixelGrid<Integer> paint(ContourResult result, int height, int width) {
        PixelGrid<Integer> canvas = new PixelGrid<>(height, width, 0);
        drawContours(canvas, result.getRoot(), 1);
        return canvas;
    }
}
