package io.regtruth.pipeline.agent;

import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
public interface AgentOutputParser<T> {

    /**
     * @throws InvalidAgentOutputException when the output does not match the expected schema
     */
    T parse(JsonNode output);
}
