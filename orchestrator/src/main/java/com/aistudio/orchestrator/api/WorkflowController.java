package com.aistudio.orchestrator.api;

import com.aistudio.orchestrator.api.dto.JobAcceptedResponse;
import com.aistudio.orchestrator.api.dto.JobResponse;
import com.aistudio.orchestrator.api.dto.ResumeRequest;
import com.aistudio.orchestrator.api.dto.StoryRequest;
import com.aistudio.orchestrator.service.JobQueueManager;
import com.aistudio.orchestrator.service.StoryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /api/workflows/story-generation/execute           start an illustrated story
 * POST /api/workflows/story-generation/resume/{jobId}    decide on a paused outline
 */
@RestController
@RequestMapping("/api/workflows")
public class WorkflowController {

    private final StoryService    stories;
    private final JobQueueManager jobs;

    public WorkflowController(StoryService stories, JobQueueManager jobs) {
        this.stories = stories;
        this.jobs    = jobs;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/workflows/story-generation/execute \
     *     -H "Content-Type: application/json" \
     *     -d '{"character":{"name":"Luna","appearance":"curly brown hair"},"theme":"mystery"}'
     */
    @PostMapping("/story-generation/execute")
    public ResponseEntity<?> executeStory(@RequestParam(name = "async_mode", defaultValue = "true") boolean asyncMode,
                                          @Valid @RequestBody StoryRequest request) {
        String jobId = stories.submit(request.toParams(), request.reviewOutline(), asyncMode);
        if (!asyncMode) {
            return ResponseEntity.ok(JobResponse.from(jobs.getJob(jobId)));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobAcceptedResponse.from(jobs.getJob(jobId)));
    }

    @PostMapping("/story-generation/resume/{jobId}")
    public JobResponse resumeStory(@PathVariable String jobId, @Valid @RequestBody ResumeRequest request) {
        return JobResponse.from(stories.resume(jobId, request.toDecision()));
    }
}
