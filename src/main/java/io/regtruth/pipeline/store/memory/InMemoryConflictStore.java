package io.regtruth.pipeline.store.memory;

import io.regtruth.pipeline.domain.ConflictStatus;
import io.regtruth.pipeline.domain.RegulatoryConflict;
import io.regtruth.pipeline.store.ConflictStore;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class InMemoryConflictStore implements ConflictStore {

    private final Map<String, RegulatoryConflict> conflicts = new LinkedHashMap<>();

    @Override
    public synchronized Optional<RegulatoryConflict> createIfNoOpen(RegulatoryConflict conflict) {
        if (conflict.isRuleConflict()) {
            boolean duplicate = conflicts.values().stream()
                    .anyMatch(existing -> existing.status() == ConflictStatus.OPEN
                            && existing.involvesPair(conflict.itemAId(), conflict.itemBId()));
            if (duplicate) {
                return Optional.empty();
            }
        }
        conflicts.put(conflict.id(), conflict);
        return Optional.of(conflict);
    }

    @Override
    public synchronized Optional<RegulatoryConflict> findById(String id) {
        return Optional.ofNullable(conflicts.get(id));
    }

    @Override
    public synchronized List<RegulatoryConflict> findOpen(int limit) {
        return conflicts.values().stream()
                .filter(conflict -> conflict.status() == ConflictStatus.OPEN)
                .sorted(Comparator.comparing(RegulatoryConflict::createdAt))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized List<RegulatoryConflict> findByStatus(ConflictStatus status) {
        return conflicts.values().stream()
                .filter(conflict -> conflict.status() == status)
                .toList();
    }

    @Override
    public synchronized boolean compareAndSet(String id, ConflictStatus expectedStatus, RegulatoryConflict updated) {
        RegulatoryConflict current = conflicts.get(id);
        if (current == null || current.status() != expectedStatus) {
            return false;
        }
        conflicts.put(id, updated);
        return true;
    }
}
