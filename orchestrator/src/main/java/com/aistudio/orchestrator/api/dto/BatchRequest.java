package com.aistudio.orchestrator.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/** Request body for POST /api/agents/{agentId}/batch: one agent input per item. */
public record BatchRequest(@NotEmpty List<Map<String, Object>> items) {}
