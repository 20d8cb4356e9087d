package io.regtruth.pipeline.store;

import io.regtruth.pipeline.domain.DiscoveredItem;
import io.regtruth.pipeline.domain.DiscoveredItemStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

public interface DiscoveredItemStore {

    Optional<DiscoveredItem> findById(String id);

    Optional<DiscoveredItem> findByUrl(String url);

    /**
     * Atomically insert unless an item with the same URL exists.
     *
     * @return the stored item, which is the existing one on conflict
     */
    DiscoveredItem insertIfAbsent(DiscoveredItem item);

    /**
     * Apply {@code change} only if the item is still in {@code expectedStatus}.
     *
     * @return the updated item, or empty when the item is missing or its status moved on
     */
    Optional<DiscoveredItem> updateIfStatus(String id, DiscoveredItemStatus expectedStatus,
                                            UnaryOperator<DiscoveredItem> change);

    List<DiscoveredItem> findByStatus(DiscoveredItemStatus status);

    List<DiscoveredItem> findDue(Set<DiscoveredItemStatus> statuses, Instant now);

    List<DiscoveredItem> findAll();
}
