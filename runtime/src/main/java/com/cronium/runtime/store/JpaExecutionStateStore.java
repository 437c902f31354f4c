package com.cronium.runtime.store;

import com.cronium.runtime.model.StateEntry;
import com.cronium.runtime.model.StateEntryId;
import com.cronium.runtime.repository.StateEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link ExecutionStateStore} backed by the execution_state table in PostgreSQL.
 *
 * Each call runs in its own short transaction with a deadline of
 * {@code runtime.store.timeout}; the transaction manager turns that into a
 * JDBC statement timeout, so a stuck database aborts the call instead of
 * holding the request thread.
 */
@Component
public class JpaExecutionStateStore implements ExecutionStateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaExecutionStateStore.class);

    private final StateEntryRepository repo;
    private final ObjectMapper         json;
    private final TransactionTemplate  tx;
    private final Clock                clock;

    public JpaExecutionStateStore(StateEntryRepository repo,
                                  ObjectMapper objectMapper,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock,
                                  @Value("${runtime.store.timeout:5s}") Duration timeout) {
        this.repo  = repo;
        this.json  = objectMapper;
        this.clock = clock;
        this.tx    = new TransactionTemplate(transactionManager);
        this.tx.setTimeout((int) Math.max(1, timeout.toSeconds()));
    }

    @Override
    public Optional<JsonNode> get(StateKey key) {
        return call("get " + key, () -> repo.findById(idOf(key))
                .map(StateEntry::getValueJson)
                .map(this::parse));
    }

    @Override
    public void put(StateKey key, JsonNode value) {
        String valueJson = serialize(value);
        call("put " + key, () -> repo.upsertValue(
                key.type().name(), key.executionId(), key.key(), valueJson, clock.instant()));
    }

    @Override
    public boolean exists(StateKey key) {
        return call("exists " + key, () -> repo.existsById(idOf(key)));
    }

    @Override
    public long increment(StateKey key) {
        return call("increment " + key, () -> repo.incrementCounter(
                key.type().name(), key.executionId(), key.key(), clock.instant()));
    }

    @Override
    public int append(StateKey key, JsonNode value) {
        String valueJson = serialize(value);
        return call("append " + key, () -> repo.appendValue(
                key.type().name(), key.executionId(), key.key(), valueJson, clock.instant()));
    }

    @Override
    public int deleteExpired(StateType type, Instant cutoff) {
        return call("deleteExpired " + type, () -> repo.deleteByTypeUpdatedBefore(type.name(), cutoff));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Run one store operation in a bounded transaction, translating backend failures. */
    private <T> T call(String opName, Supplier<T> op) {
        try {
            return tx.execute(status -> op.get());
        } catch (DataAccessException | TransactionException | PersistenceException e) {
            log.warn("State store operation '{}' failed: {}", opName, e.getMessage());
            throw new StateStoreUnavailableException("State store unavailable during " + opName, e);
        }
    }

    private static StateEntryId idOf(StateKey key) {
        return new StateEntryId(key.type().name(), key.executionId(), key.key());
    }

    private JsonNode parse(String valueJson) {
        if (valueJson == null) {
            return json.nullNode();
        }
        try {
            return json.readTree(valueJson);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt state entry: " + e.getOriginalMessage(), e);
        }
    }

    private String serialize(JsonNode value) {
        try {
            return json.writeValueAsString(value == null ? json.nullNode() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }
}
