package com.rastertopo.server.service;

import com.rastertopo.server.config.TopologyConfig;
import com.rastertopo.server.contour.ContourResult;
import com.rastertopo.server.contour.ContourRetrieval;
import com.rastertopo.server.image.PixelGrid;
import com.rastertopo.server.labeling.Connectivity;
import com.rastertopo.server.labeling.LabelingResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TopologyServiceTest {

    private static final int[][] DIAGONAL = {
            { 1, 0, 1 },
            { 0, 1, 0 }
    };

    @Test
    void testConfiguredDefaultsApplyWhenArgumentsAbsent() {
        TopologyService service = new TopologyService(TopologyConfig.defaults());

        LabelingResult result = service.labelComponents(DIAGONAL, null, null);
        assertEquals(Connectivity.EIGHT_CONNECTED, result.getConnectivity());
        assertEquals(1, result.getComponentCount());

        ContourResult contours = service.findContours(DIAGONAL, null);
        assertEquals(ContourRetrieval.TREE, contours.getRetrieval());
        assertEquals(1, contours.getContourCount());
    }

    @Test
    void testExplicitArgumentsOverrideConfig() {
        TopologyConfig config = TopologyConfig.defaults();
        config.labeling.connectivity = "4";
        TopologyService service = new TopologyService(config);

        assertEquals(3, service.labelComponents(DIAGONAL, null, "two_pass").getComponentCount());
        assertEquals(1, service.labelComponents(DIAGONAL, "eight", "two_pass").getComponentCount());
    }

    @Test
    void testOversizedGridIsRejected() {
        TopologyConfig config = TopologyConfig.defaults();
        config.maxPixels = 4;
        TopologyService service = new TopologyService(config);

        assertThrows(IllegalArgumentException.class, () -> service.labelComponents(DIAGONAL, null, null));
        assertThrows(IllegalArgumentException.class, () -> service.findContours(DIAGONAL, null));
        assertEquals(1, service.labelComponents(new int[][] { { 1, 1 }, { 1, 1 } }, null, null)
                .getComponentCount());
    }

    @Test
    void testUnknownConnectivityIsRejected() {
        TopologyService service = new TopologyService(TopologyConfig.defaults());

        assertThrows(IllegalArgumentException.class, () -> service.labelComponents(DIAGONAL, "6", null));
        assertThrows(IllegalArgumentException.class, () -> service.findContours(DIAGONAL, "flat"));
    }

    @Test
    void testRaggedGridIsTreatedAsEmpty() {
        TopologyService service = new TopologyService(TopologyConfig.defaults());
        int[][] ragged = { { 1, 1 }, { 1 } };

        LabelingResult result = service.labelComponents(ragged, null, null);
        assertEquals(0, result.getComponentCount());
        assertTrue(result.getLabels().isEmpty());
        assertEquals(0, service.findContours(ragged, null).getContourCount());
    }

    @Test
    void testContourMask() {
        TopologyService service = new TopologyService(TopologyConfig.defaults());
        int[][] block = {
                { 0, 0, 0, 0, 0 },
                { 0, 1, 1, 1, 0 },
                { 0, 1, 1, 1, 0 },
                { 0, 1, 1, 1, 0 },
                { 0, 0, 0, 0, 0 }
        };

        PixelGrid<Integer> mask = service.contourMask(block, null);

        assertArrayEquals(new int[][] {
                { 0, 0, 0, 0, 0 },
                { 0, 1, 1, 1, 0 },
                { 0, 1, 0, 1, 0 },
                { 0, 1, 1, 1, 0 },
                { 0, 0, 0, 0, 0 }
        }, PixelGrid.toIntArray(mask));
    }
}
