package io.regtruth.pipeline.store.memory;

import io.regtruth.pipeline.store.RuleGraph;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryRuleGraph implements RuleGraph {

    private final Map<String, Set<String>> overrides = new ConcurrentHashMap<>();

    @Override
    public void addOverride(String overridingRuleId, String overriddenRuleId) {
        overrides.computeIfAbsent(overridingRuleId, key -> ConcurrentHashMap.newKeySet()).add(overriddenRuleId);
    }

    @Override
    public boolean overrides(String a, String b) {
        if (a.equals(b)) {
            return false;
        }
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(a);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (String next : overrides.getOrDefault(current, Set.of())) {
                if (next.equals(b)) {
                    return true;
                }
                queue.add(next);
            }
        }
        return false;
    }
}
