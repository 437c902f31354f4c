package com.cronium.runtime.repository;

import com.cronium.runtime.model.StateEntry;
import com.cronium.runtime.model.StateEntryId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

/**
 * Access to the execution_state table.
 *
 * Writes go through PostgreSQL upserts (INSERT ... ON CONFLICT DO UPDATE) so
 * each write is a single atomic statement per key: two writers racing on the
 * same variable both succeed and the later one wins, with no read-modify-write
 * window and no unique-constraint failures.
 */
public interface StateEntryRepository extends JpaRepository<StateEntry, StateEntryId> {

    @Modifying
    @Query(value = """
            INSERT INTO execution_state (state_type, execution_id, state_key, value_json, counter, updated_at)
            VALUES (:type, :executionId, :key, :valueJson, 0, :updatedAt)
            ON CONFLICT (state_type, execution_id, state_key)
            DO UPDATE SET value_json = EXCLUDED.value_json,
                          updated_at = EXCLUDED.updated_at
            """, nativeQuery = true)
    int upsertValue(@Param("type")        String type,
                    @Param("executionId") String executionId,
                    @Param("key")         String key,
                    @Param("valueJson")   String valueJson,
                    @Param("updatedAt")   Instant updatedAt);

    /** Atomic counter bump; returns the counter after the increment. */
    @Query(value = """
            INSERT INTO execution_state (state_type, execution_id, state_key, value_json, counter, updated_at)
            VALUES (:type, :executionId, :key, NULL, 1, :updatedAt)
            ON CONFLICT (state_type, execution_id, state_key)
            DO UPDATE SET counter    = execution_state.counter + 1,
                          updated_at = EXCLUDED.updated_at
            RETURNING counter
            """, nativeQuery = true)
    long incrementCounter(@Param("type")        String type,
                          @Param("executionId") String executionId,
                          @Param("key")         String key,
                          @Param("updatedAt")   Instant updatedAt);

    /**
     * Atomic append to the JSON array stored at the key; returns the array length afterwards.
     * A missing entry starts a new array, an existing non-array value becomes its first element.
     */
    @Query(value = """
            INSERT INTO execution_state (state_type, execution_id, state_key, value_json, counter, updated_at)
            VALUES (:type, :executionId, :key,
                    CAST(jsonb_build_array(CAST(:valueJson AS jsonb)) AS text), 0, :updatedAt)
            ON CONFLICT (state_type, execution_id, state_key)
            DO UPDATE SET value_json = CAST(
                              (CASE
                                   WHEN execution_state.value_json IS NULL
                                       THEN CAST('[]' AS jsonb)
                                   WHEN jsonb_typeof(CAST(execution_state.value_json AS jsonb)) = 'array'
                                       THEN CAST(execution_state.value_json AS jsonb)
                                   ELSE jsonb_build_array(CAST(execution_state.value_json AS jsonb))
                               END) || CAST(EXCLUDED.value_json AS jsonb) AS text),
                          updated_at = EXCLUDED.updated_at
            RETURNING jsonb_array_length(CAST(value_json AS jsonb))
            """, nativeQuery = true)
    int appendValue(@Param("type")        String type,
                    @Param("executionId") String executionId,
                    @Param("key")         String key,
                    @Param("valueJson")   String valueJson,
                    @Param("updatedAt")   Instant updatedAt);

    @Modifying
    @Query("DELETE FROM StateEntry e WHERE e.id.type = :type AND e.updatedAt < :cutoff")
    int deleteByTypeUpdatedBefore(@Param("type") String type, @Param("cutoff") Instant cutoff);
}
