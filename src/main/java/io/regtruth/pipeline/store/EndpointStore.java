package io.regtruth.pipeline.store;

import io.regtruth.pipeline.domain.DiscoveryEndpoint;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface EndpointStore {

    DiscoveryEndpoint save(DiscoveryEndpoint endpoint);

    /**
     * Insert unless an endpoint with the same id exists; returns the stored endpoint.
     */
    DiscoveryEndpoint saveIfAbsent(DiscoveryEndpoint endpoint);

    Optional<DiscoveryEndpoint> findById(String id);

    List<DiscoveryEndpoint> findAll();

    Optional<DiscoveryEndpoint> update(String id, UnaryOperator<DiscoveryEndpoint> change);
}
