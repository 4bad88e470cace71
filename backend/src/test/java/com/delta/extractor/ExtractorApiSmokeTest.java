package com.delta.extractor;

import com.delta.extractor.model.JobState;
import com.delta.extractor.model.ResourceDescriptor;
import com.delta.extractor.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.time.Instant;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ExtractorApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private StateStore stateStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void transfersEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/transfers"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void submitWithoutUrlIsRejected() throws Exception {
        mockMvc.perform(post("/api/transfers")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"jobId\":\"no-url\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void persistedJobIsReadable() throws Exception {
        stateStore.putJob(JobState.pending(
            "smoke-job",
            new ResourceDescriptor("smoke-resource", "http://127.0.0.1:9/file.bin", 2048L, "137"),
            "target/test-downloads/smoke.bin",
            Instant.parse("2024-05-01T10:00:00Z")
        ));

        mockMvc.perform(get("/api/jobs/smoke-job"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.resourceId").value("smoke-resource"))
            .andExpect(jsonPath("$.variantId").value("137"))
            .andExpect(jsonPath("$.status").value("pending"))
            .andExpect(jsonPath("$.createdAt").value("2024-05-01T10:00:00Z"));

        mockMvc.perform(get("/api/jobs/incomplete"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());

        stateStore.deleteJob("smoke-job");
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/jobs/does-not-exist"))
            .andExpect(status().isNotFound());
    }

    @Test
    void invalidJobIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/jobs/bad id!"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void breakersAndArtifactStatusAreExposed() throws Exception {
        mockMvc.perform(get("/api/breakers"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());

        mockMvc.perform(get("/api/artifact/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cachedVersionIds").isArray());
    }
}
