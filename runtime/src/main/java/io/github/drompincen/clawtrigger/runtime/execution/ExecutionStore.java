package io.github.drompincen.clawtrigger.runtime.execution;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;

import java.time.Instant;
import java.util.Optional;

public interface ExecutionStore {

    BackgroundExecutionDocument insert(BackgroundExecutionDocument execution);

    Optional<BackgroundExecutionDocument> findById(String executionId);

    /**
     * Applies the transition only if the stored record still has {@code expectedVersion} and
     * {@code expectedStatus}; on success the version is incremented by one and {@code updatedAt} set.
     *
     * @return the updated record, or empty when the record changed (or vanished) since it was read
     */
    Optional<BackgroundExecutionDocument> compareAndSet(String executionId, long expectedVersion,
                                                        ExecutionStatus expectedStatus, ExecutionStatus next,
                                                        ExecutionMutation mutation, Instant now);
}
