package io.regtruth.pipeline.api.service;

import io.regtruth.pipeline.config.PipelineConfig;
import io.regtruth.pipeline.domain.AgentType;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Validated agent outputs keyed by agent type and input. Redis outages degrade to cache misses.
 */
@Service
public class AgentResultCache {

    private static final Logger logger = LoggerFactory.getLogger(AgentResultCache.class);

    private static final String AGENT_RESULT_PREFIX = "agent:result:";

    private final RedisTemplate<String, String> redisTemplate;
    private final Duration ttl;

    public AgentResultCache(RedisTemplate<String, String> redisTemplate, PipelineConfig config) {
        this.redisTemplate = redisTemplate;
        this.ttl = config.arbiter().cacheTtl();
    }

    public Optional<String> get(AgentType agentType, String input) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(generateKey(agentType, input)));
        } catch (RuntimeException e) {
            logger.warn("Agent result cache read failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public void put(AgentType agentType, String input, String output) {
        try {
            redisTemplate.opsForValue().set(generateKey(agentType, input), output, ttl);
        } catch (RuntimeException e) {
            logger.warn("Agent result cache write failed: {}", e.getMessage());
        }
    }

    public void evict(AgentType agentType, String input) {
        try {
            redisTemplate.delete(generateKey(agentType, input));
        } catch (RuntimeException e) {
            logger.warn("Agent result cache eviction failed: {}", e.getMessage());
        }
    }

    String generateKey(AgentType agentType, String input) {
        return AGENT_RESULT_PREFIX + DigestUtils.sha256Hex(agentType.name() + ":" + input);
    }
}
