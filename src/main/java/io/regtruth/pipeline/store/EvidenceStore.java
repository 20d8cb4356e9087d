package io.regtruth.pipeline.store;

import io.regtruth.pipeline.domain.Evidence;

import java.util.Optional;

public interface EvidenceStore {

    /**
     * Insert evidence unless the same (url, contentHash) already exists.
     */
    Upsert upsert(Evidence evidence);

    Optional<Evidence> findById(String id);

    Optional<Evidence> findLatestByUrl(String url);

    Optional<Evidence> attachDerivedText(String id, String derivedText);

    record Upsert(Evidence evidence, boolean created) {}
}
