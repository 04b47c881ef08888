package com.aistudio.orchestrator.api;

import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentNotFoundException;
import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.model.JobStatus;
import com.aistudio.orchestrator.service.AgentJobService;
import com.aistudio.orchestrator.service.BatchService;
import com.aistudio.orchestrator.service.JobQueueManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static com.aistudio.orchestrator.api.JobControllerTest.fakeJob;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AgentController.class)
class AgentControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean AgentRegistry   agents;
    @MockitoBean AgentJobService agentJobs;
    @MockitoBean BatchService    batches;
    @MockitoBean JobQueueManager jobs;

    @Test
    void listAgents_returnsConfigs() throws Exception {
        when(agents.configs()).thenReturn(List.of(AgentConfig.of("image_generator", "Image Generator", "one image")));

        mockMvc.perform(get("/api/agents"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].agentId").value("image_generator"))
                .andExpect(jsonPath("$[0].version").value("1.0.0"));
    }

    @Test
    void run_async_returns202() throws Exception {
        when(agentJobs.submit(eq("image_generator"), anyMap(), eq(true))).thenReturn("job-1");
        when(jobs.getJob("job-1")).thenReturn(fakeJob("job-1", JobStatus.QUEUED));

        mockMvc.perform(post("/api/agents/{agentId}/run", "image_generator")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prompt":"a fox"}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-1"));
    }

    @Test
    void run_sync_returnsFinishedSnapshot() throws Exception {
        when(agentJobs.runNow(eq("image_generator"), anyMap())).thenReturn(fakeJob("job-2", JobStatus.COMPLETED));

        mockMvc.perform(post("/api/agents/{agentId}/run", "image_generator")
                        .param("async_mode", "false")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prompt":"a fox"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"));
    }

    @Test
    void run_unknownAgent_returns404() throws Exception {
        when(agentJobs.submit(eq("ghost"), anyMap(), eq(true))).thenThrow(new AgentNotFoundException("ghost"));

        mockMvc.perform(post("/api/agents/{agentId}/run", "ghost")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Agent not found: 'ghost'"));
    }

    @Test
    void batch_returns202() throws Exception {
        when(batches.submit(eq("image_generator"), anyList())).thenReturn("job-3");
        when(jobs.getJob("job-3")).thenReturn(fakeJob("job-3", JobStatus.QUEUED));

        mockMvc.perform(post("/api/agents/{agentId}/batch", "image_generator")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items":[{"prompt":"a fox"},{"prompt":"an owl"}]}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-3"));
    }

    @Test
    void batch_noItems_returns400() throws Exception {
        mockMvc.perform(post("/api/agents/{agentId}/batch", "image_generator")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"items":[]}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(batches);
    }
}
