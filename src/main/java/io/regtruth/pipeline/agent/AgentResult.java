package io.regtruth.pipeline.agent;

public sealed interface AgentResult {

    record Success(String output) implements AgentResult {}

    record Failure(String error) implements AgentResult {}
}
