package com.aistudio.orchestrator.repository;

import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.HashMap;

/**
 * Map-backed {@link EntityStore}.
 *
 * A reference is any non-identity field whose value is another entity's id,
 * either directly or as an element of a list field.
 */
@Repository
public class InMemoryEntityStore implements EntityStore {

    static final Set<String> IDENTITY_FIELDS = Set.of("id", "created_at");

    private final Map<String, Map<String, Object>> entities = new HashMap<>();

    /** Insert or replace an entity. The map must carry an {@code id}. */
    public synchronized void save(Map<String, Object> entity) {
        Object id = entity.get("id");
        if (id == null) {
            throw new IllegalArgumentException("Entity has no 'id' field");
        }
        entities.put(id.toString(), new LinkedHashMap<>(entity));
    }

    @Override
    public synchronized Optional<Map<String, Object>> find(String entityId) {
        Map<String, Object> entity = entities.get(entityId);
        return entity == null ? Optional.empty() : Optional.of(Map.copyOf(withoutNulls(entity)));
    }

    @Override
    public synchronized Map<String, Object> update(String entityId, Map<String, Object> fields) {
        Map<String, Object> entity = require(entityId);
        fields.forEach((key, value) -> {
            if (!IDENTITY_FIELDS.contains(key)) {
                entity.put(key, value);
            }
        });
        entity.put("updated_at", Instant.now().toString());
        return Map.copyOf(withoutNulls(entity));
    }

    @Override
    public synchronized void archive(String entityId, String mergedInto) {
        Map<String, Object> entity = require(entityId);
        entity.put("archived", true);
        entity.put("merged_into", mergedInto);
        entity.put("updated_at", Instant.now().toString());
    }

    @Override
    public synchronized int reassignReferences(String fromId, String toId) {
        int changed = 0;
        for (Map<String, Object> entity : entities.values()) {
            boolean touched = false;
            for (Map.Entry<String, Object> field : entity.entrySet()) {
                if (IDENTITY_FIELDS.contains(field.getKey())) continue;
                Object value = field.getValue();
                if (fromId.equals(value)) {
                    field.setValue(toId);
                    touched = true;
                } else if (value instanceof List<?> list && list.contains(fromId)) {
                    List<Object> replaced = new ArrayList<>(list.size());
                    for (Object element : list) {
                        replaced.add(fromId.equals(element) ? toId : element);
                    }
                    field.setValue(replaced);
                    touched = true;
                }
            }
            if (touched) changed++;
        }
        return changed;
    }

    private Map<String, Object> require(String entityId) {
        Map<String, Object> entity = entities.get(entityId);
        if (entity == null) {
            throw new IllegalArgumentException("Entity not found: " + entityId);
        }
        return entity;
    }

    // Map.copyOf rejects null values.
    private static Map<String, Object> withoutNulls(Map<String, Object> entity) {
        Map<String, Object> copy = new LinkedHashMap<>();
        entity.forEach((k, v) -> { if (v != null) copy.put(k, v); });
        return copy;
    }
}
