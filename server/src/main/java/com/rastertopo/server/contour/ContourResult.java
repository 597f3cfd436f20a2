package com.rastertopo.server.contour;

import com.rastertopo.server.image.GridPoint;

import java.util.ArrayList;
import java.util.List;

public class ContourResult {
    private final Contour root;
    private final ContourRetrieval retrieval;
    private final int degenerateBorderCount;

    public ContourResult(Contour root, ContourRetrieval retrieval, int degenerateBorderCount) {
        this.root = root;
        this.retrieval = retrieval;
        this.degenerateBorderCount = degenerateBorderCount;
    }

    public Contour getRoot() {
        return root;
    }

    public ContourRetrieval getRetrieval() {
        return retrieval;
    }

    public int getDegenerateBorderCount() {
        return degenerateBorderCount;
    }

    /** Contours below the root, depth-first. */
    public List<Contour> getContours() {
        return root.descendants();
    }

    public int getContourCount() {
        return getContours().size();
    }

    /** Point list of every contour, in the order of {@link #getContours()}. */
    public List<List<GridPoint>> getContourPoints() {
        List<List<GridPoint>> points = new ArrayList<>();
        for (Contour contour : getContours()) {
            points.add(contour.getPoints());
        }
        return points;
    }
}
