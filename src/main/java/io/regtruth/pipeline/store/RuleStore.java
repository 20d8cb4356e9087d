package io.regtruth.pipeline.store;

import io.regtruth.pipeline.domain.RegulatoryRule;
import io.regtruth.pipeline.domain.RuleStatus;
import io.regtruth.pipeline.domain.SourcePointer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface RuleStore {

    /**
     * @throws IllegalArgumentException if a rule with the same id exists
     */
    RegulatoryRule create(RegulatoryRule rule);

    Optional<RegulatoryRule> findById(String id);

    List<RegulatoryRule> findByConceptSlug(String conceptSlug, Set<RuleStatus> statuses);

    List<RegulatoryRule> findAll();

    /**
     * Source pointers with the given ids that are still attached to a stored rule.
     */
    List<SourcePointer> findSourcePointers(Collection<String> pointerIds);

    /**
     * Replace the rule only if it is still in {@code expectedStatus}. Status writes go through
     * {@code RuleStatusService}; nothing else should call this.
     */
    boolean compareAndSetStatus(String id, RuleStatus expectedStatus, RegulatoryRule updated);

    /**
     * @return number of rules updated
     * @throws BulkStatusUpdateNotAllowedException if the patch carries a status
     */
    int updateMany(Collection<String> ids, RulePatch patch);
}
