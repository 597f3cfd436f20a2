package com.rastertopo.server.image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;

/**
 * Row-major 2-D buffer addressed by (row, col).
 * <p>
 * Every access is bounds-checked: {@link #get} throws for coordinates outside
 * {@code [0, height) x [0, width)}, while {@link #tryGet} answers
 * {@link Optional#empty()} so neighbor probes can walk off the grid edge.
 * {@link #set}, {@link #resize} and {@link #clear} are the only mutators.
 *
 * @param <T> cell type
 */
public class PixelGrid<T> {

    private static final Logger logger = LoggerFactory.getLogger(PixelGrid.class);

    private int height;
    private int width;
    private Object[] data;

    public PixelGrid(int height, int width, T fill) {
        if (height < 0 || width < 0) {
            throw new IllegalArgumentException("Grid dimensions must be non-negative: " + height + "x" + width);
        }
        allocate(height, width, fill);
    }

    /**
     * Builds an integer grid from nested rows. Null, empty or ragged input is
     * treated as having no usable dimensions and yields an empty grid.
     */
    public static PixelGrid<Integer> fromArray(int[][] rows) {
        if (rows == null || rows.length == 0 || rows[0] == null || rows[0].length == 0) {
            return new PixelGrid<>(0, 0, 0);
        }
        int width = rows[0].length;
        for (int[] row : rows) {
            if (row == null || row.length != width) {
                logger.warn("Ignoring ragged grid: expected {} columns in every one of {} rows", width, rows.length);
                return new PixelGrid<>(0, 0, 0);
            }
        }
        PixelGrid<Integer> grid = new PixelGrid<>(rows.length, width, 0);
        for (int r = 0; r < rows.length; r++) {
            for (int c = 0; c < width; c++) {
                grid.set(r, c, rows[r][c]);
            }
        }
        return grid;
    }

    public static int[][] toIntArray(PixelGrid<Integer> grid) {
        int[][] rows = new int[grid.getHeight()][grid.getWidth()];
        for (int r = 0; r < grid.getHeight(); r++) {
            for (int c = 0; c < grid.getWidth(); c++) {
                rows[r][c] = grid.get(r, c);
            }
        }
        return rows;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getSize() {
        return height * width;
    }

    public boolean isEmpty() {
        return getSize() == 0;
    }

    public boolean contains(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    @SuppressWarnings("unchecked")
    public T get(int row, int col) {
        checkBounds(row, col);
        return (T) data[row * width + col];
    }

    @SuppressWarnings("unchecked")
    public Optional<T> tryGet(int row, int col) {
        if (!contains(row, col)) {
            return Optional.empty();
        }
        return Optional.ofNullable((T) data[row * width + col]);
    }

    public void set(int row, int col, T value) {
        checkBounds(row, col);
        data[row * width + col] = value;
    }

    /**
     * Reallocates the grid to the given dimensions. Previous contents are
     * discarded and every cell is set to {@code fill}.
     */
    public void resize(int height, int width, T fill) {
        if (height < 0 || width < 0) {
            throw new IllegalArgumentException("Grid dimensions must be non-negative: " + height + "x" + width);
        }
        allocate(height, width, fill);
    }

    /** Releases the storage, leaving a 0x0 grid. */
    public void clear() {
        allocate(0, 0, null);
    }

    public PixelGrid<T> copy() {
        PixelGrid<T> copy = new PixelGrid<>(0, 0, null);
        copy.height = height;
        copy.width = width;
        copy.data = Arrays.copyOf(data, data.length);
        return copy;
    }

    private void allocate(int height, int width, T fill) {
        this.height = height;
        this.width = width;
        this.data = new Object[height * width];
        Arrays.fill(this.data, fill);
    }

    private void checkBounds(int row, int col) {
        if (!contains(row, col)) {
            throw new IndexOutOfBoundsException(
                    "(" + row + ", " + col + ") is outside " + height + "x" + width + " grid");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PixelGrid)) {
            return false;
        }
        PixelGrid<?> other = (PixelGrid<?>) o;
        return height == other.height && width == other.width && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * height + width) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PixelGrid[" + height + "x" + width + "]";
    }
}
