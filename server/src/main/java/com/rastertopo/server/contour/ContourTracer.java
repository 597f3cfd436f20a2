package com.rastertopo.server.contour;

import com.rastertopo.server.image.Direction;
import com.rastertopo.server.image.GridPoint;
import com.rastertopo.server.image.PixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Topological border following (Suzuki and Abe, 1985).
 * <p>
 * A single row-major scan finds every outer border (foreground against the
 * background around it) and every hole border (foreground around an enclosed
 * background region), follows each one, and links them into a tree whose root
 * stands for the frame around the image. Foreground is 8-connected, background
 * 4-connected; any nonzero input value counts as foreground.
 * <p>
 * The caller's grid is never modified. Tracing runs on a private marker grid
 * where visited border pixels receive the signed id of their border: negative
 * when the border leaves the pixel across its east edge, positive otherwise.
 * <p>
 * Instances hold no scan state and may be shared between threads.
 */
public class ContourTracer {

    private static final Logger logger = LoggerFactory.getLogger(ContourTracer.class);

    private static final int ROOT_ID = 1;

    private final NeighborProbe probe;

    public ContourTracer() {
        this(DirectionalTracer::activeNeighbor);
    }

    ContourTracer(NeighborProbe probe) {
        this.probe = probe;
    }

    private enum TraceOutcome {
        SINGLE_POINT, CLOSED, DEGENERATE
    }

    /** Per-call scan state. */
    private static final class ScanState {
        final Contour root;
        final Map<Integer, Contour> borders = new HashMap<>();
        int nbd = ROOT_ID;
        int lnbd = ROOT_ID;
        int degenerate = 0;

        ScanState(Contour root) {
            this.root = root;
            borders.put(ROOT_ID, root);
        }

        Contour lookup(int id) {
            Contour border = borders.get(id);
            return border != null ? border : root;
        }
    }

    public ContourResult extractContours(PixelGrid<Integer> image) {
        return findContours(image, ContourRetrieval.TREE);
    }

    public ContourResult findContours(PixelGrid<Integer> image, ContourRetrieval retrieval) {
        Contour root = new Contour(ContourType.BACKGROUND);
        if (image.isEmpty()) {
            return new ContourResult(root, retrieval, 0);
        }

        PixelGrid<Integer> markers = binaryCopy(image);
        ScanState state = new ScanState(root);
        int height = markers.getHeight();
        int width = markers.getWidth();

        for (int i = 0; i < height; i++) {
            state.lnbd = ROOT_ID;

            for (int j = 0; j < width; j++) {
                int f = markers.get(i, j);
                boolean outer = isOuterBorderStart(markers, i, j);
                if (outer || isHoleBorderStart(markers, i, j)) {
                    startBorder(markers, i, j, f, outer, state);
                }

                int marker = markers.get(i, j);
                if (marker != 0 && marker != 1) {
                    state.lnbd = Math.abs(marker);
                }
            }
        }

        if (state.degenerate > 0) {
            logger.warn("Discarded {} degenerate border(s) while tracing {}x{} grid", state.degenerate, height,
                    width);
        }

        applyRetrieval(root, retrieval);
        ContourResult result = new ContourResult(root, retrieval, state.degenerate);
        logger.debug("Traced {} contours ({}) in {}x{} grid", result.getContourCount(), retrieval, height, width);
        return result;
    }

    private void startBorder(PixelGrid<Integer> markers, int i, int j, int f, boolean outer, ScanState state) {
        state.nbd++;
        int nbd = state.nbd;

        Contour border;
        GridPoint from;
        Contour enclosing;
        Contour parent;
        if (outer) {
            border = new Contour(ContourType.OUTER);
            from = new GridPoint(i, j - 1);
            enclosing = state.lookup(state.lnbd);
            parent = enclosing.getType() == ContourType.OUTER ? enclosing.getParent() : enclosing;
        } else {
            if (f > 1) {
                state.lnbd = f;
            }
            border = new Contour(ContourType.HOLE);
            from = new GridPoint(i, j + 1);
            enclosing = state.lookup(state.lnbd);
            parent = enclosing.getType() == ContourType.OUTER ? enclosing : enclosing.getParent();
        }
        if (parent == null) {
            parent = state.root;
        }
        border.attachTo(parent);

        GridPoint start = new GridPoint(i, j);
        TraceOutcome outcome = followBorder(markers, start, from, border, nbd);
        switch (outcome) {
            case SINGLE_POINT:
                border.addPoint(start);
                markers.set(i, j, -nbd);
                state.borders.put(nbd, border);
                break;
            case CLOSED:
                state.borders.put(nbd, border);
                break;
            case DEGENERATE:
                // Roll back: the id resolves to the border this one would have nested in.
                border.detach();
                markers.set(i, j, -nbd);
                state.borders.put(nbd, enclosing);
                state.degenerate++;
                logger.debug("Degenerate {} border {} starting at {} discarded", border.getType(), nbd, start);
                break;
            default:
                throw new IllegalStateException("Unexpected trace outcome " + outcome);
        }
    }

    private TraceOutcome followBorder(PixelGrid<Integer> markers, GridPoint ij, GridPoint from, Contour border,
            int nbd) {
        Direction dir = DirectionalTracer.direction(ij, from);
        Direction trace = dir.clockwise();
        GridPoint i1j1 = null;

        while (trace != dir) {
            Optional<GridPoint> active = probe.probe(markers, ij, trace);
            if (active.isPresent()) {
                i1j1 = active.get();
                break;
            }
            trace = trace.clockwise();
        }

        if (i1j1 == null) {
            return TraceOutcome.SINGLE_POINT;
        }

        GridPoint i2j2 = i1j1;
        GridPoint i3j3 = ij;
        Set<Direction> examined = EnumSet.noneOf(Direction.class);

        while (true) {
            dir = DirectionalTracer.direction(i3j3, i2j2);
            trace = dir.counterClockwise();
            examined.clear();

            GridPoint i4j4 = null;
            for (int attempt = 0; attempt < Direction.values().length; attempt++) {
                Optional<GridPoint> active = probe.probe(markers, i3j3, trace);
                if (active.isPresent()) {
                    i4j4 = active.get();
                    break;
                }
                examined.add(trace);
                trace = trace.counterClockwise();
            }

            if (i4j4 == null) {
                return TraceOutcome.DEGENERATE;
            }

            markBorderPixel(markers, border, i3j3, examined, nbd);

            if (i4j4.equals(ij) && i3j3.equals(i1j1)) {
                return TraceOutcome.CLOSED;
            }

            i2j2 = i3j3;
            i3j3 = i4j4;
        }
    }

    private static void markBorderPixel(PixelGrid<Integer> markers, Contour border, GridPoint point,
            Set<Direction> examined, int nbd) {
        border.addPoint(point);

        int row = point.getRow();
        int col = point.getCol();
        int value = markers.get(row, col);
        if (value != 0 && (col == markers.getWidth() - 1 || examined.contains(Direction.EAST))) {
            markers.set(row, col, -nbd);
        } else if (value == 1) {
            markers.set(row, col, nbd);
        }
    }

    private static boolean isOuterBorderStart(PixelGrid<Integer> markers, int i, int j) {
        return markers.get(i, j) == 1 && (j == 0 || markers.get(i, j - 1) == 0);
    }

    private static boolean isHoleBorderStart(PixelGrid<Integer> markers, int i, int j) {
        return markers.get(i, j) >= 1 && (j == markers.getWidth() - 1 || markers.get(i, j + 1) == 0);
    }

    private static PixelGrid<Integer> binaryCopy(PixelGrid<Integer> image) {
        PixelGrid<Integer> markers = new PixelGrid<>(image.getHeight(), image.getWidth(), 0);
        for (int r = 0; r < image.getHeight(); r++) {
            for (int c = 0; c < image.getWidth(); c++) {
                if (image.get(r, c) != 0) {
                    markers.set(r, c, 1);
                }
            }
        }
        return markers;
    }

    private static void applyRetrieval(Contour root, ContourRetrieval retrieval) {
        switch (retrieval) {
            case TREE:
                break;
            case LIST:
                List<Contour> all = root.descendants();
                for (Contour contour : all) {
                    contour.detach();
                }
                for (Contour contour : all) {
                    contour.attachTo(root);
                }
                break;
            case EXTERNAL:
                for (Contour top : List.copyOf(root.getChildren())) {
                    if (top.getType() != ContourType.OUTER) {
                        top.detach();
                        continue;
                    }
                    for (Contour nested : List.copyOf(top.getChildren())) {
                        nested.detach();
                    }
                }
                break;
            default:
                throw new IllegalArgumentException("Unsupported retrieval " + retrieval);
        }
    }
}
