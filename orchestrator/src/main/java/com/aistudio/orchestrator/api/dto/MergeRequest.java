package com.aistudio.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Request body for POST /api/merge/analyze.
 *
 * The source entity keeps its id; the target is archived once the merge is approved.
 */
public record MergeRequest(
        @JsonAlias("entity_type")   @NotBlank String entityType,
        @JsonAlias("source_entity") @NotNull  Map<String, Object> sourceEntity,
        @JsonAlias("target_entity") @NotNull  Map<String, Object> targetEntity
) {}
