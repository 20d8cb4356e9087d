package io.regtruth.pipeline.discovery;

public record EndpointDiscoveryResult(
        String endpointId,
        boolean success,
        int urlsFound,
        int newItems,
        int requeuedItems,
        String error
) {
    public static EndpointDiscoveryResult failed(String endpointId, String error) {
        return new EndpointDiscoveryResult(endpointId, false, 0, 0, 0, error);
    }
}
