package com.rastertopo.server.contour;

import com.rastertopo.server.image.GridPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a border tree. A node owns its children; the parent link is a
 * plain back-reference maintained by {@link #attachTo} and {@link #detach}.
 */
public class Contour {
    private final ContourType type;
    private final List<GridPoint> points = new ArrayList<>();
    private final List<Contour> children = new ArrayList<>();
    private Contour parent;

    public Contour(ContourType type) {
        this.type = type;
    }

    public ContourType getType() {
        return type;
    }

    public List<GridPoint> getPoints() {
        return Collections.unmodifiableList(points);
    }

    public List<Contour> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public Contour getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    void addPoint(GridPoint point) {
        points.add(point);
    }

    void attachTo(Contour newParent) {
        if (parent != null) {
            detach();
        }
        parent = newParent;
        newParent.children.add(this);
    }

    void detach() {
        if (parent != null) {
            parent.children.remove(this);
            parent = null;
        }
    }

    /** All nodes below this one, depth-first, parents before their children. */
    public List<Contour> descendants() {
        List<Contour> out = new ArrayList<>();
        collect(this, out);
        return out;
    }

    private static void collect(Contour node, List<Contour> out) {
        for (Contour child : node.children) {
            out.add(child);
            collect(child, out);
        }
    }

    @Override
    public String toString() {
        return "Contour[" + type + ", " + points.size() + " points, " + children.size() + " children]";
    }
}
