package com.cronium.runtime.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store for service tests. Mirrors the semantics of the
 * database store: last write wins, increment and append are atomic per key.
 */
public class InMemoryExecutionStateStore implements ExecutionStateStore {

    private record Entry(JsonNode value, long counter, Instant updatedAt) {}

    private final Map<StateKey, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryExecutionStateStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<JsonNode> get(StateKey key) {
        return Optional.ofNullable(entries.get(key)).map(Entry::value);
    }

    @Override
    public void put(StateKey key, JsonNode value) {
        entries.compute(key, (k, e) -> new Entry(value, e == null ? 0 : e.counter(), clock.instant()));
    }

    @Override
    public boolean exists(StateKey key) {
        return entries.containsKey(key);
    }

    @Override
    public long increment(StateKey key) {
        return entries.compute(key, (k, e) -> e == null
                ? new Entry(null, 1, clock.instant())
                : new Entry(e.value(), e.counter() + 1, clock.instant())).counter();
    }

    @Override
    public int append(StateKey key, JsonNode value) {
        return ((ArrayNode) entries.compute(key, (k, e) -> {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            if (e != null && e.value() != null) {
                if (e.value().isArray()) {
                    array.addAll((ArrayNode) e.value());
                } else {
                    array.add(e.value());
                }
            }
            array.add(value);
            return new Entry(array, e == null ? 0 : e.counter(), clock.instant());
        }).value()).size();
    }

    @Override
    public int deleteExpired(StateType type, Instant cutoff) {
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getKey().type() == type && e.getValue().updatedAt().isBefore(cutoff));
        return before - entries.size();
    }

    public int size() {
        return entries.size();
    }
}
