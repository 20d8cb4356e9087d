package io.regtruth.pipeline.scheduler;

import io.regtruth.pipeline.domain.DiscoveredItemStatus;

public class IllegalItemTransitionException extends RuntimeException {
    private final String itemId;
    private final DiscoveredItemStatus from;
    private final DiscoveredItemStatus to;

    public IllegalItemTransitionException(String itemId, DiscoveredItemStatus from, DiscoveredItemStatus to) {
        super("Illegal discovered item transition for " + itemId + ": " + from + " → " + to);
        this.itemId = itemId;
        this.from = from;
        this.to = to;
    }

    public String getItemId() {
        return itemId;
    }

    public DiscoveredItemStatus getFrom() {
        return from;
    }

    public DiscoveredItemStatus getTo() {
        return to;
    }
}
