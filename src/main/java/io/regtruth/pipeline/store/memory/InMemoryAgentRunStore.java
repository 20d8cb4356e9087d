package io.regtruth.pipeline.store.memory;

import io.regtruth.pipeline.domain.AgentRun;
import io.regtruth.pipeline.store.AgentRunStore;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class InMemoryAgentRunStore implements AgentRunStore {

    private final List<AgentRun> runs = new CopyOnWriteArrayList<>();

    @Override
    public void append(AgentRun run) {
        runs.add(run);
    }

    @Override
    public List<AgentRun> findByConflictId(String conflictId) {
        return runs.stream()
                .filter(run -> Objects.equals(run.conflictId(), conflictId))
                .toList();
    }

    @Override
    public List<AgentRun> findAll() {
        return List.copyOf(runs);
    }
}
