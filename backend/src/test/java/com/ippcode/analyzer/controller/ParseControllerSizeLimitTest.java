package com.ippcode.analyzer.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "ippcode.analyzer.max-source-code-length=20")
@AutoConfigureMockMvc
class ParseControllerSizeLimitTest {

    private static final String LONG_SOURCE = ".IPPcode24\nCREATEFRAME\nPUSHFRAME\n";

    @Autowired
    private MockMvc mockMvc;

    @Test
    void jsonEndpointHonoursConfiguredLimit() throws Exception {
        mockMvc.perform(post("/api/parse")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .content("{\"sourceCode\": \".IPPcode24\\nCREATEFRAME\\nPUSHFRAME\\n\"}"))
            .andExpect(status().isPayloadTooLarge())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error", containsString("20 characters")));
    }

    @Test
    void xmlEndpointHonoursConfiguredLimit() throws Exception {
        mockMvc.perform(post("/api/parse/xml")
                    .contentType(MediaType.TEXT_PLAIN)
                    .content(LONG_SOURCE))
            .andExpect(status().isPayloadTooLarge());
    }

    @Test
    void sourceWithinLimitIsParsed() throws Exception {
        mockMvc.perform(post("/api/parse")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .content("{\"sourceCode\": \".IPPcode24\\nBREAK\\n\"}"))
            .andExpect(status().isOk());
    }
}
