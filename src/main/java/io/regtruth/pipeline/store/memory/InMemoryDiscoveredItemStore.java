package io.regtruth.pipeline.store.memory;

import io.regtruth.pipeline.domain.DiscoveredItem;
import io.regtruth.pipeline.domain.DiscoveredItemStatus;
import io.regtruth.pipeline.store.DiscoveredItemStore;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryDiscoveredItemStore implements DiscoveredItemStore {

    private final Map<String, DiscoveredItem> itemsById = new ConcurrentHashMap<>();
    private final Map<String, String> idsByUrl = new ConcurrentHashMap<>();

    @Override
    public Optional<DiscoveredItem> findById(String id) {
        return Optional.ofNullable(itemsById.get(id));
    }

    @Override
    public Optional<DiscoveredItem> findByUrl(String url) {
        String id = idsByUrl.get(url);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public synchronized DiscoveredItem insertIfAbsent(DiscoveredItem item) {
        String existingId = idsByUrl.putIfAbsent(item.url(), item.id());
        if (existingId != null) {
            return itemsById.get(existingId);
        }
        itemsById.put(item.id(), item);
        return item;
    }

    @Override
    public Optional<DiscoveredItem> updateIfStatus(String id, DiscoveredItemStatus expectedStatus,
                                                   UnaryOperator<DiscoveredItem> change) {
        boolean[] applied = {false};
        DiscoveredItem result = itemsById.computeIfPresent(id, (key, current) -> {
            if (current.status() != expectedStatus) {
                return current;
            }
            applied[0] = true;
            return change.apply(current);
        });
        return applied[0] ? Optional.ofNullable(result) : Optional.empty();
    }

    @Override
    public List<DiscoveredItem> findByStatus(DiscoveredItemStatus status) {
        return itemsById.values().stream()
                .filter(item -> item.status() == status)
                .toList();
    }

    @Override
    public List<DiscoveredItem> findDue(Set<DiscoveredItemStatus> statuses, Instant now) {
        return itemsById.values().stream()
                .filter(item -> statuses.contains(item.status()))
                .filter(item -> item.nextScanDue() == null || !item.nextScanDue().isAfter(now))
                .toList();
    }

    @Override
    public List<DiscoveredItem> findAll() {
        return List.copyOf(itemsById.values());
    }
}
