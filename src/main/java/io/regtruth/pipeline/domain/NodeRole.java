package io.regtruth.pipeline.domain;

public enum NodeRole {
    REGULATION,
    GUIDANCE,
    NEWS_FEED,
    FORM,
    ARCHIVE
}
