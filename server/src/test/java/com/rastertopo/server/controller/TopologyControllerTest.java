package com.rastertopo.server.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class TopologyControllerTest {

    private static final String DIAGONAL = "[[1,0,1],[0,1,0]]";

    @Autowired
    MockMvc mvc;

    @Test
    void testConnectedComponentsWithDefaults() throws Exception {
        mvc.perform(post("/connected-components")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pixels\": " + DIAGONAL + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.componentCount").value(1))
                .andExpect(jsonPath("$.connectivity").value("EIGHT_CONNECTED"))
                .andExpect(jsonPath("$.width").value(3))
                .andExpect(jsonPath("$.height").value(2))
                .andExpect(jsonPath("$.labels[1][1]").value(1));
    }

    @Test
    void testConnectedComponentsFourConnected() throws Exception {
        mvc.perform(post("/connected-components")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pixels\": " + DIAGONAL + ", \"connectivity\": \"4\", \"strategy\": \"two_pass\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.componentCount").value(3))
                .andExpect(jsonPath("$.connectivity").value("FOUR_CONNECTED"))
                .andExpect(jsonPath("$.labels[0][1]").value(0));
    }

    @Test
    void testUnknownConnectivityIsBadRequest() throws Exception {
        mvc.perform(post("/connected-components")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pixels\": " + DIAGONAL + ", \"connectivity\": \"6\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("connectivity")));
    }

    @Test
    void testMissingPixelsIsBadRequest() throws Exception {
        mvc.perform(post("/contours")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"retrieval\": \"list\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Missing pixel grid."));
    }

    @Test
    void testContourTree() throws Exception {
        mvc.perform(post("/contours")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pixels\": [[1,0,0],[0,0,0]]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.contourCount").value(1))
                .andExpect(jsonPath("$.degenerateBorders").value(0))
                .andExpect(jsonPath("$.root.type").value("BACKGROUND"))
                .andExpect(jsonPath("$.root.children[0].type").value("OUTER"))
                .andExpect(jsonPath("$.root.children[0].points[0].row").value(0))
                .andExpect(jsonPath("$.root.children[0].points[0].col").value(0));
    }

    @Test
    void testContourMask() throws Exception {
        mvc.perform(post("/contours/mask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pixels\": [[0,0,0],[0,5,0],[0,0,0]], \"retrieval\": \"external\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.width").value(3))
                .andExpect(jsonPath("$.mask[1][1]").value(1))
                .andExpect(jsonPath("$.mask[0][0]").value(0));
    }
}
