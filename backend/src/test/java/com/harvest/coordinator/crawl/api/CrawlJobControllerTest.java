package com.harvest.coordinator.crawl.api;

import com.harvest.coordinator.crawl.service.CrawlJobOrchestrator;
import com.harvest.coordinator.crawl.state.CrawlState;
import com.harvest.coordinator.crawl.support.ScriptedFetchConfig;
import com.harvest.coordinator.crawl.support.ScriptedFetchWorker;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.time.Duration;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Import(ScriptedFetchConfig.class)
class CrawlJobControllerTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private CrawlJobOrchestrator orchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void submitReturnsAcceptedJobAndDetailEndpointsServeIt() throws Exception {
        String jobId = submitAndFinish(ScriptedFetchWorker.uniqueHost() + "/a");

        mockMvc.perform(get("/api/jobs/" + jobId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.state").value("COMPLETED"))
            .andExpect(jsonPath("$.counters.urlsCrawled").value(1))
            .andExpect(jsonPath("$.history.length()").value(6));

        mockMvc.perform(get("/api/jobs/" + jobId + "/events").param("kind", "crawl_complete"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].kind").value("CRAWL_COMPLETE"));

        mockMvc.perform(get("/api/jobs/" + jobId + "/iterations"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].iterationNumber").value(0))
            .andExpect(jsonPath("$[0].summary.newCount").value(1));

        mockMvc.perform(get("/api/jobs/" + jobId + "/checkpoints/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobId").value(jobId));
    }

    @Test
    void unknownJobIsNotFound() throws Exception {
        mockMvc.perform(get("/api/jobs/job-does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("job_not_found"));
    }

    @Test
    void badSubmissionsAreRejected() throws Exception {
        mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("{\"targets\":[]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));

        String incremental = "{\"targets\":[\"" + ScriptedFetchWorker.uniqueHost() + "/\"],\"mode\":\"INCREMENTAL\"}";
        mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(incremental))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("no_baseline"));

        String unknownMode = "{\"targets\":[\"" + ScriptedFetchWorker.uniqueHost() + "/\"],\"mode\":\"SIDEWAYS\"}";
        mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(unknownMode))
            .andExpect(status().isBadRequest());
    }

    @Test
    void comparisonExportsCsv() throws Exception {
        String jobId = submitAndFinish(ScriptedFetchWorker.uniqueHost() + "/report");

        mockMvc.perform(get("/api/jobs/" + jobId + "/iterations/compare").param("format", "csv"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(new MediaType("text", "csv")))
            .andExpect(header().string("Content-Disposition", containsString("comparison-0-0.csv")))
            .andExpect(content().string(containsString("uri,change_type,baseline_iteration,current_iteration")))
            .andExpect(content().string(containsString("/report,UNCHANGED,0,0")));

        mockMvc.perform(get("/api/jobs/" + jobId + "/iterations/compare"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.unchangedCount").value(1));

        mockMvc.perform(get("/api/jobs/" + jobId + "/iterations/compare").param("format", "xml"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void metricsWindowMustBeKnown() throws Exception {
        String jobId = submitAndFinish(ScriptedFetchWorker.uniqueHost() + "/m");

        mockMvc.perform(get("/api/jobs/" + jobId + "/metrics/series").param("window", "7d"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));

        mockMvc.perform(get("/api/jobs/" + jobId + "/metrics/series").param("window", "1h"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.urls_crawled.length()").value(60));
    }

    @Test
    void finishedJobCannotResumeButCanBeDeleted() throws Exception {
        String jobId = submitAndFinish(ScriptedFetchWorker.uniqueHost() + "/d");

        mockMvc.perform(post("/api/jobs/" + jobId + "/resume"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("invalid_transition"));

        mockMvc.perform(delete("/api/jobs/" + jobId))
            .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/jobs/" + jobId))
            .andExpect(status().isNotFound());
    }

    private String submitAndFinish(String target) throws Exception {
        String body = "{\"targets\":[\"" + target + "\"],\"mode\":\"BASELINE\"}";
        MvcResult result = mockMvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.mode").value("BASELINE"))
            .andReturn();
        String jobId = JsonPath.read(result.getResponse().getContentAsString(), "$.jobId");
        assertEquals(CrawlState.COMPLETED, orchestrator.awaitRunner(jobId, Duration.ofSeconds(10)).state());
        return jobId;
    }
}
