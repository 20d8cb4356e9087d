package io.regtruth.pipeline.discovery;

import io.regtruth.pipeline.domain.FreshnessRisk;
import io.regtruth.pipeline.domain.NodeRole;
import io.regtruth.pipeline.domain.NodeType;

public record UrlClassification(
        NodeType nodeType,
        NodeRole nodeRole,
        FreshnessRisk freshnessRisk
) {}
