package io.regtruth.pipeline.store;

import io.regtruth.pipeline.domain.AgentRun;

import java.util.List;

public interface AgentRunStore {

    void append(AgentRun run);

    List<AgentRun> findByConflictId(String conflictId);

    List<AgentRun> findAll();
}
