package io.regtruth.pipeline.domain;

public enum NodeType {
    HUB,    // listing page linking to other documents
    LEAF,   // a single document page
    ASSET   // binary attachment
}
