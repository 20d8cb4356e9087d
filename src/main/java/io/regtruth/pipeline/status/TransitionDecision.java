package io.regtruth.pipeline.status;

public sealed interface TransitionDecision {

    record Allowed() implements TransitionDecision {}

    record Denied(String reason) implements TransitionDecision {}

    default boolean isAllowed() {
        return this instanceof Allowed;
    }
}
