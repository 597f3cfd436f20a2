package com.rastertopo.server.labeling;

import com.rastertopo.server.image.PixelGrid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FloodFillLabelerTest {

    private final FloodFillLabeler labeler = new FloodFillLabeler();

    @Test
    void testReferenceGridCounts() {
        PixelGrid<Integer> image = PixelGrid.fromArray(LabelingFixtures.REFERENCE_9x17);

        LabelingResult eight = labeler.label(image, Connectivity.EIGHT_CONNECTED);
        assertEquals(2, eight.getComponentCount());
        assertEquals(1, eight.getLabels().get(1, 2));
        assertEquals(2, eight.getLabels().get(1, 10));
        // joined to the right-hand blob only through a diagonal
        assertEquals(2, eight.getLabels().get(7, 6));

        LabelingResult four = labeler.label(image, Connectivity.FOUR_CONNECTED);
        assertEquals(6, four.getComponentCount());
        assertEquals(3, four.getLabels().get(4, 14));
        assertEquals(4, four.getLabels().get(5, 6));
        assertEquals(5, four.getLabels().get(7, 6));
        assertEquals(6, four.getLabels().get(7, 15));
    }

    @Test
    void testDiagonallyTouchingBlobs() {
        PixelGrid<Integer> image = PixelGrid.fromArray(LabelingFixtures.FOUR_BLOBS_9x17);

        assertEquals(4, labeler.label(image, Connectivity.EIGHT_CONNECTED).getComponentCount());
        assertEquals(16, labeler.label(image, Connectivity.FOUR_CONNECTED).getComponentCount());
    }

    @Test
    void testLabelsAreContiguousInDiscoveryOrder() {
        PixelGrid<Integer> image = PixelGrid.fromArray(new int[][] {
                { 0, 1, 0, 1 },
                { 0, 0, 0, 0 },
                { 1, 0, 1, 1 }
        });
        LabelingResult result = labeler.label(image, Connectivity.FOUR_CONNECTED);

        assertEquals(4, result.getComponentCount());
        assertArrayEquals(new int[][] {
                { 0, 1, 0, 2 },
                { 0, 0, 0, 0 },
                { 3, 0, 4, 4 }
        }, PixelGrid.toIntArray(result.getLabels()));
    }

    @Test
    void testDifferentValuesAreDifferentComponents() {
        PixelGrid<Integer> image = PixelGrid.fromArray(new int[][] { { 1, 1, 2, 2 } });
        LabelingResult result = labeler.label(image, Connectivity.EIGHT_CONNECTED);

        assertEquals(2, result.getComponentCount());
        assertNotEquals(result.getLabels().get(0, 1), result.getLabels().get(0, 2));
    }

    @Test
    void testInputIsNotModified() {
        int[][] rows = { { 1, 1 }, { 0, 1 } };
        PixelGrid<Integer> image = PixelGrid.fromArray(rows);
        labeler.label(image, Connectivity.EIGHT_CONNECTED);

        assertArrayEquals(rows, PixelGrid.toIntArray(image));
    }

    @Test
    void testEmptyImage() {
        LabelingResult result = labeler.label(PixelGrid.fromArray(new int[0][0]), Connectivity.FOUR_CONNECTED);

        assertEquals(0, result.getComponentCount());
        assertTrue(result.getLabels().isEmpty());
    }

    @Test
    void testAllBackground() {
        LabelingResult result = labeler.label(new PixelGrid<>(3, 3, 0), Connectivity.EIGHT_CONNECTED);

        assertEquals(0, result.getComponentCount());
        assertEquals(3, result.getLabels().getHeight());
    }
}
