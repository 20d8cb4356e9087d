package io.regtruth.pipeline.store.memory;

import io.regtruth.pipeline.domain.DiscoveryEndpoint;
import io.regtruth.pipeline.store.EndpointStore;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryEndpointStore implements EndpointStore {

    private final Map<String, DiscoveryEndpoint> endpoints = new ConcurrentHashMap<>();

    @Override
    public DiscoveryEndpoint save(DiscoveryEndpoint endpoint) {
        endpoints.put(endpoint.id(), endpoint);
        return endpoint;
    }

    @Override
    public DiscoveryEndpoint saveIfAbsent(DiscoveryEndpoint endpoint) {
        DiscoveryEndpoint existing = endpoints.putIfAbsent(endpoint.id(), endpoint);
        return existing != null ? existing : endpoint;
    }

    @Override
    public Optional<DiscoveryEndpoint> findById(String id) {
        return Optional.ofNullable(endpoints.get(id));
    }

    @Override
    public List<DiscoveryEndpoint> findAll() {
        return endpoints.values().stream()
                .sorted(Comparator.comparing(DiscoveryEndpoint::id))
                .toList();
    }

    @Override
    public Optional<DiscoveryEndpoint> update(String id, UnaryOperator<DiscoveryEndpoint> change) {
        return Optional.ofNullable(endpoints.computeIfPresent(id, (key, current) -> change.apply(current)));
    }
}
