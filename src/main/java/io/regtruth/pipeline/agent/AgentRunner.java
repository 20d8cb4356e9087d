package io.regtruth.pipeline.agent;

/**
 * Model backend. Receives a JSON input document and returns the model's JSON output or an
 * error; it must not throw for model-side failures.
 */
public interface AgentRunner {

    AgentResult runAgent(AgentRequest request);
}
