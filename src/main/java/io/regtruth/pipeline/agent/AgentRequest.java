package io.regtruth.pipeline.agent;

import io.regtruth.pipeline.domain.AgentType;

public record AgentRequest(
        AgentType agentType,
        String input,
        double temperature
) {}
