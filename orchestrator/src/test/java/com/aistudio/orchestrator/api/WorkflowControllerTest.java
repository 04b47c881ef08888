package com.aistudio.orchestrator.api;

import com.aistudio.orchestrator.model.JobStatus;
import com.aistudio.orchestrator.service.JobQueueManager;
import com.aistudio.orchestrator.service.StoryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static com.aistudio.orchestrator.api.JobControllerTest.fakeJob;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(WorkflowController.class)
class WorkflowControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean StoryService    stories;
    @MockitoBean JobQueueManager jobs;

    @Test
    @SuppressWarnings("unchecked")
    void execute_appliesDefaultsAndReturns202() throws Exception {
        when(stories.submit(anyMap(), anyBoolean(), eq(true))).thenReturn("job-1");
        when(jobs.getJob("job-1")).thenReturn(fakeJob("job-1", JobStatus.QUEUED));

        mockMvc.perform(post("/api/workflows/story-generation/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"character":{"name":"Luna","appearance":"curly brown hair"},
                                 "theme":"mystery","review_outline":true}
                                """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.jobId").value("job-1"));

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(stories).submit(params.capture(), eq(true), eq(true));
        assertThat(params.getValue())
                .containsEntry("theme", "mystery")
                .containsEntry("target_scenes", 5)
                .containsEntry("age_group", "children")
                .containsEntry("character_appearance", "curly brown hair");
    }

    @Test
    void execute_withoutCharacter_returns400() throws Exception {
        mockMvc.perform(post("/api/workflows/story-generation/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"theme":"mystery"}
                                """))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(stories);
    }

    @Test
    void execute_tooManyScenes_returns400() throws Exception {
        mockMvc.perform(post("/api/workflows/story-generation/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"character":{"name":"Luna"},"target_scenes":50}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void resume_approve_returnsSnapshot() throws Exception {
        when(stories.resume(eq("job-2"), any())).thenReturn(fakeJob("job-2", JobStatus.RUNNING));

        mockMvc.perform(post("/api/workflows/story-generation/resume/{jobId}", "job-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"action":"approve"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("running"));
    }
}
