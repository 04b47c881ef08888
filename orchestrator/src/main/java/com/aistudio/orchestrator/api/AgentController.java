package com.aistudio.orchestrator.api;

import com.aistudio.orchestrator.agent.AgentConfig;
import com.aistudio.orchestrator.agent.AgentRegistry;
import com.aistudio.orchestrator.api.dto.BatchRequest;
import com.aistudio.orchestrator.api.dto.JobAcceptedResponse;
import com.aistudio.orchestrator.api.dto.JobResponse;
import com.aistudio.orchestrator.service.AgentJobService;
import com.aistudio.orchestrator.service.BatchService;
import com.aistudio.orchestrator.service.JobQueueManager;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * GET  /api/agents                    registered agents
 * POST /api/agents/{agentId}/run      one agent call as a job (?async_mode=false waits for it)
 * POST /api/agents/{agentId}/batch    the same agent over many independent inputs
 */
@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final AgentRegistry   agents;
    private final AgentJobService agentJobs;
    private final BatchService    batches;
    private final JobQueueManager jobs;

    public AgentController(AgentRegistry agents, AgentJobService agentJobs,
                           BatchService batches, JobQueueManager jobs) {
        this.agents    = agents;
        this.agentJobs = agentJobs;
        this.batches   = batches;
        this.jobs      = jobs;
    }

    @GetMapping
    public List<AgentConfig> list() {
        return agents.configs();
    }

    @PostMapping("/{agentId}/run")
    public ResponseEntity<?> run(@PathVariable String agentId,
                                 @RequestParam(name = "async_mode", defaultValue = "true") boolean asyncMode,
                                 @RequestBody(required = false) Map<String, Object> input) {
        if (!asyncMode) {
            return ResponseEntity.ok(JobResponse.from(agentJobs.runNow(agentId, input)));
        }
        String jobId = agentJobs.submit(agentId, input, true);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobAcceptedResponse.from(jobs.getJob(jobId)));
    }

    @PostMapping("/{agentId}/batch")
    public ResponseEntity<JobAcceptedResponse> batch(@PathVariable String agentId,
                                                     @Valid @RequestBody BatchRequest request) {
        String jobId = batches.submit(agentId, request.items());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobAcceptedResponse.from(jobs.getJob(jobId)));
    }
}
