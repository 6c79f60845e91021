package com.dtinsight.analysis.api;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "analysis.data.load-on-startup=false")
@ActiveProfiles("test")
class DatasetUnavailableEndpointTest {

    @Autowired
    private WebApplicationContext context;

    @Test
    void analysisWithoutDatasetIsServiceUnavailable() throws Exception {
        MockMvc mockMvc = MockMvcBuilders.webAppContextSetup(context).build();

        mockMvc.perform(get("/api/ranking"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("dataset_unavailable"));

        mockMvc.perform(get("/api/dataset"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.loaded").value(false));
    }
}
