package com.cronium.runtime.model;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.time.Instant;

/**
 * One row of the namespaced key/value table backing all execution state.
 *
 * value_json holds the serialized entry (input, output, variable, condition,
 * context); counter is only used by RATE entries.
 *
 * DB table: execution_state (created by Flyway V1 migration)
 */
@Entity
@Table(name = "execution_state")
public class StateEntry {

    @EmbeddedId
    private StateEntryId id;

    @Column(name = "value_json", columnDefinition = "TEXT")
    private String valueJson;

    @Column(nullable = false)
    private long counter;

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMPTZ")
    private Instant updatedAt;

    protected StateEntry() {}   // required by JPA

    public StateEntry(StateEntryId id, String valueJson, Instant updatedAt) {
        this.id        = id;
        this.valueJson = valueJson;
        this.updatedAt = updatedAt;
    }

    public StateEntryId getId()        { return id; }
    public String       getValueJson() { return valueJson; }
    public long         getCounter()   { return counter; }
    public Instant      getUpdatedAt() { return updatedAt; }
}
