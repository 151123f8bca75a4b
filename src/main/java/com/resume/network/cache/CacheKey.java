package com.resume.network.cache;

import com.resume.network.core.model.SearchOperation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Cache key: operation, its inputs and the version of the snapshot it ran against.
 * Inputs must have value semantics (records, strings, numbers, immutable queries); nulls are allowed.
 */
public record CacheKey(SearchOperation operation, List<Object> inputs, long snapshotVersion) {

    public CacheKey {
        Objects.requireNonNull(operation, "operation is required");
        inputs = inputs != null ? Collections.unmodifiableList(new ArrayList<>(inputs)) : List.of();
    }

    public static CacheKey of(SearchOperation operation, long snapshotVersion, Object... inputs) {
        return new CacheKey(operation, Arrays.asList(inputs), snapshotVersion);
    }
}
