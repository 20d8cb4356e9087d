package io.regtruth.pipeline.store;

import io.regtruth.pipeline.domain.ConflictStatus;
import io.regtruth.pipeline.domain.RegulatoryConflict;

import java.util.List;
import java.util.Optional;

public interface ConflictStore {

    /**
     * Atomically create the conflict unless an OPEN conflict already exists for the same
     * unordered rule pair. Conflicts without a rule pair are always created.
     *
     * @return the created conflict, or empty if it was a duplicate
     */
    Optional<RegulatoryConflict> createIfNoOpen(RegulatoryConflict conflict);

    Optional<RegulatoryConflict> findById(String id);

    /**
     * Oldest first.
     */
    List<RegulatoryConflict> findOpen(int limit);

    List<RegulatoryConflict> findByStatus(ConflictStatus status);

    boolean compareAndSet(String id, ConflictStatus expectedStatus, RegulatoryConflict updated);
}
