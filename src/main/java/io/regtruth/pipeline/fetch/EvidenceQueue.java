package io.regtruth.pipeline.fetch;

import io.regtruth.pipeline.domain.Evidence;

/**
 * Hand-off of new evidence to downstream extraction. Delivery is best-effort.
 */
public interface EvidenceQueue {

    void queueForExtraction(Evidence evidence);

    void queueForOcr(Evidence evidence);
}
