package io.regtruth.pipeline.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used until a real backend bean is provided. Every call fails, so conflicts stay OPEN.
 */
public class UnconfiguredAgentRunner implements AgentRunner {

    private static final Logger logger = LoggerFactory.getLogger(UnconfiguredAgentRunner.class);

    @Override
    public AgentResult runAgent(AgentRequest request) {
        logger.warn("No agent backend configured; {} request not executed", request.agentType());
        return new AgentResult.Failure("No agent backend configured for " + request.agentType());
    }
}
