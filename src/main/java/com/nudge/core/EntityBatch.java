package com.nudge.core;

import com.nudge.entity.EntityAdapter;

import java.util.List;
import java.util.Objects;

/**
 * Entities of one record kind together with their adapter.
 *
 * @param entities Entity snapshots
 * @param adapter  Adapter for the entities' record kind
 * @param <E>      Entity type
 */
public record EntityBatch<E>(List<E> entities, EntityAdapter<E> adapter) {

    public EntityBatch {
        Objects.requireNonNull(adapter, "adapter cannot be null");
        entities = entities == null ? List.of() : entities;
    }

    public static <E> EntityBatch<E> of(List<E> entities, EntityAdapter<E> adapter) {
        return new EntityBatch<>(entities, adapter);
    }

    public String recordKind() {
        return adapter.recordKind();
    }
}
