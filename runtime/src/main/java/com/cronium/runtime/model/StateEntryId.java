package com.cronium.runtime.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite primary key of {@link StateEntry}: (state_type, execution_id, state_key).
 */
@Embeddable
public class StateEntryId implements Serializable {

    @Column(name = "state_type", nullable = false, length = 16)
    private String type;

    @Column(name = "execution_id", nullable = false)
    private String executionId;

    @Column(name = "state_key", nullable = false, length = 256)
    private String key;

    protected StateEntryId() {}   // required by JPA

    public StateEntryId(String type, String executionId, String key) {
        this.type        = type;
        this.executionId = executionId;
        this.key         = key;
    }

    public String getType()        { return type; }
    public String getExecutionId() { return executionId; }
    public String getKey()         { return key; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateEntryId other)) return false;
        return type.equals(other.type)
            && executionId.equals(other.executionId)
            && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, executionId, key);
    }
}
