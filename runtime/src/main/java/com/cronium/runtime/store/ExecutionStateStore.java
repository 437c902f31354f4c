package com.cronium.runtime.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage-agnostic access contract for per-execution state.
 *
 * Implementations must make {@link #put}, {@link #increment} and {@link #append} atomic per
 * key: concurrent writers to the same key end with one complete value, never
 * a mix. No cross-key transactions are required.
 *
 * All methods throw {@link StateStoreUnavailableException} when the backend
 * cannot be reached or does not answer within its deadline. A missing entry
 * is an empty Optional, not an error.
 */
public interface ExecutionStateStore {

    Optional<JsonNode> get(StateKey key);

    /** Insert or overwrite; last write wins. */
    void put(StateKey key, JsonNode value);

    boolean exists(StateKey key);

    /** Atomically add one to the counter at {@code key} (starting from 0) and return the new value. */
    long increment(StateKey key);

    /**
     * Atomically add {@code value} to the end of the JSON array at {@code key}
     * and return the array's new length. A missing entry starts a new array;
     * an existing value that is not an array becomes the first element.
     */
    int append(StateKey key, JsonNode value);

    /** Remove entries of the given type last written before {@code cutoff}. */
    int deleteExpired(StateType type, Instant cutoff);
}
