package com.example.docassembly.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AssemblyControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private static String word(String value, int x0, int y0, int x1, int y1) {
        return "{\"value\":\"" + value + "\",\"geometry\":{\"topLeft\":{\"x\":" + x0 + ",\"y\":" + y0
            + "},\"bottomRight\":{\"x\":" + x1 + ",\"y\":" + y1 + "}}}";
    }

    private static String box(int x0, int y0, int x1, int y1) {
        return "{\"topLeft\":{\"x\":" + x0 + ",\"y\":" + y0 + "},\"bottomRight\":{\"x\":" + x1 + ",\"y\":" + y1 + "}}";
    }

    @Test
    void assemblesTitleAndImage() throws Exception {
        String body = "{\"pages\":[{"
            + "\"dimensions\":{\"width\":200,\"height\":300},"
            + "\"lines\":["
            + "{\"words\":[" + word("Hello", 5, 2, 95, 10) + "]},"
            + "{\"words\":[" + word("World", 5, 11, 95, 19) + "]}],"
            + "\"regions\":["
            + "{\"id\":\"t1\",\"label\":10,\"bbox\":" + box(0, 0, 100, 20) + "},"
            + "{\"id\":\"i1\",\"label\":\"picture\",\"bbox\":" + box(0, 50, 200, 150) + "}]"
            + "}]}";

        mockMvc.perform(post("/api/assembly").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.detectionOrigin").value("doctr"))
            .andExpect(jsonPath("$.metadata.pageCount").value(1))
            .andExpect(jsonPath("$.metadata.pageDimensions[0].width").value(200))
            .andExpect(jsonPath("$.content", hasSize(2)))
            .andExpect(jsonPath("$.content[0].type").value("TitleBlock"))
            .andExpect(jsonPath("$.content[0].text").value("Hello\nWorld"))
            .andExpect(jsonPath("$.content[0].bbox.topLeft.y").value(2.0))
            .andExpect(jsonPath("$.content[0].bbox.bottomRight.y").value(19.0))
            .andExpect(jsonPath("$.content[0].pageRange.start").value(0))
            .andExpect(jsonPath("$.content[0].pageRange.end").value(0))
            .andExpect(jsonPath("$.content[1].type").value("ImageBlock"))
            .andExpect(jsonPath("$.content[1].text").value(""));
    }

    @Test
    void emptyLineGeometryIsUnprocessable() throws Exception {
        String body = "{\"detectionOrigin\":\"test\",\"pages\":[{\"lines\":[{\"words\":[],\"text\":\"ghost\"}],\"regions\":[]}]}";

        mockMvc.perform(post("/api/assembly").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("empty_line_geometry"))
            .andExpect(jsonPath("$.pageIndex").value(0))
            .andExpect(jsonPath("$.lineIndex").value(0));
    }

    @Test
    void lineInsideTableIsDroppedByDefault() throws Exception {
        String body = "{\"pages\":[{"
            + "\"lines\":[{\"words\":[" + word("cell", 10, 60, 50, 70) + "]}],"
            + "\"regions\":[{\"id\":\"tbl\",\"label\":8,\"bbox\":" + box(0, 50, 200, 150) + "}]"
            + "}]}";

        mockMvc.perform(post("/api/assembly").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.content", hasSize(1)))
            .andExpect(jsonPath("$.content[0].type").value("TableBlock"))
            .andExpect(jsonPath("$.content[0].text").value(""))
            .andExpect(jsonPath("$.content[0].bbox.topLeft.y").value(50.0));
    }

    @Test
    void sharedRegionIdIsConflicting() throws Exception {
        String body = "{\"pages\":[{"
            + "\"lines\":[{\"words\":[" + word("caption", 10, 10, 90, 20) + "]}],"
            + "\"regions\":["
            + "{\"id\":\"dup\",\"label\":9,\"bbox\":" + box(0, 0, 100, 30) + "},"
            + "{\"id\":\"dup\",\"label\":6,\"bbox\":" + box(0, 40, 100, 200) + "}]"
            + "}]}";

        mockMvc.perform(post("/api/assembly").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("conflicting_block"))
            .andExpect(jsonPath("$.pageIndex").value(0))
            .andExpect(jsonPath("$.regionId").value("dup"));
    }

    @Test
    void regionWithoutLabelReportsItsIndex() throws Exception {
        String body = "{\"pages\":[{\"lines\":[],\"regions\":["
            + "{\"id\":\"a\",\"label\":9,\"bbox\":" + box(0, 0, 10, 10) + "},"
            + "{\"id\":\"b\",\"bbox\":" + box(0, 20, 10, 30) + "}]}]}";

        mockMvc.perform(post("/api/assembly").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("invalid_region"))
            .andExpect(jsonPath("$.regionIndex").value(1));
    }
}
