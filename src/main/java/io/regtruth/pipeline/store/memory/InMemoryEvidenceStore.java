package io.regtruth.pipeline.store.memory;

import io.regtruth.pipeline.domain.Evidence;
import io.regtruth.pipeline.store.EvidenceStore;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryEvidenceStore implements EvidenceStore {

    private final Map<String, Evidence> evidenceById = new ConcurrentHashMap<>();
    private final Map<String, String> idsByUrlAndHash = new ConcurrentHashMap<>();

    @Override
    public synchronized Upsert upsert(Evidence evidence) {
        String key = evidence.url() + "|" + evidence.contentHash();
        String existingId = idsByUrlAndHash.putIfAbsent(key, evidence.id());
        if (existingId != null) {
            return new Upsert(evidenceById.get(existingId), false);
        }
        evidenceById.put(evidence.id(), evidence);
        return new Upsert(evidence, true);
    }

    @Override
    public Optional<Evidence> findById(String id) {
        return Optional.ofNullable(evidenceById.get(id));
    }

    @Override
    public Optional<Evidence> findLatestByUrl(String url) {
        return evidenceById.values().stream()
                .filter(evidence -> evidence.url().equals(url))
                .max(Comparator.comparing(Evidence::fetchedAt));
    }

    @Override
    public Optional<Evidence> attachDerivedText(String id, String derivedText) {
        return Optional.ofNullable(evidenceById.computeIfPresent(id, (key, current) -> current.withDerivedText(derivedText)));
    }
}
