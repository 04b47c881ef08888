package com.aistudio.orchestrator.repository;

import java.util.Map;
import java.util.Optional;

/**
 * Entity storage consumed by the merge flow.
 *
 * Entities are plain field maps keyed by their {@code id} field. The studio's
 * real entity database lives outside this service; {@link InMemoryEntityStore}
 * backs local runs and tests.
 */
public interface EntityStore {

    Optional<Map<String, Object>> find(String entityId);

    /**
     * Overwrite the given fields on an entity. Identity fields ({@code id},
     * {@code created_at}) are never touched.
     *
     * @return the updated entity
     */
    Map<String, Object> update(String entityId, Map<String, Object> fields);

    /** Mark an entity archived, recording which entity absorbed it. */
    void archive(String entityId, String mergedInto);

    /**
     * Point every reference to {@code fromId} at {@code toId}.
     *
     * @return the number of entities whose references changed
     */
    int reassignReferences(String fromId, String toId);
}
