package io.regtruth.pipeline.domain;

public enum AgentType {
    ARBITER,
    EXTRACTOR,
    OCR
}
