package io.regtruth.pipeline.arbiter;

import com.fasterxml.jackson.databind.JsonNode;
import io.regtruth.pipeline.agent.AgentOutputParser;
import io.regtruth.pipeline.agent.InvalidAgentOutputException;
import io.regtruth.pipeline.domain.ConflictType;
import io.regtruth.pipeline.domain.ResolutionStrategy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the arbiter's JSON output against its contract and maps it to {@link Arbitration}.
 */
@Component
public class ArbiterOutputValidator implements AgentOutputParser<Arbitration> {

    @Override
    public Arbitration parse(JsonNode output) {
        requireObject(output, "output must be an object");
        JsonNode arbitration = requireObject(output.get("arbitration"), "arbitration must be an object");

        String conflictId = requireString(arbitration.get("conflict_id"), "arbitration.conflict_id is required");
        ConflictType conflictType = requireEnum(arbitration.get("conflict_type"), ConflictType.class,
                "arbitration.conflict_type is invalid");

        List<ConflictingItem> items = new ArrayList<>();
        JsonNode itemsNode = arbitration.get("conflicting_items");
        if (itemsNode != null && !itemsNode.isNull()) {
            if (!itemsNode.isArray()) {
                throw new InvalidAgentOutputException("arbitration.conflicting_items must be an array");
            }
            for (JsonNode item : itemsNode) {
                items.add(new ConflictingItem(
                        requireString(item.get("item_id"), "conflicting_items[].item_id is required"),
                        requireString(item.get("item_type"), "conflicting_items[].item_type is required"),
                        optionalString(item.get("claim"))));
            }
        }

        JsonNode resolution = requireObject(arbitration.get("resolution"), "arbitration.resolution must be an object");
        String winningItemId = requireString(resolution.get("winning_item_id"), "resolution.winning_item_id is required");
        ResolutionStrategy strategy;
        try {
            strategy = ResolutionStrategy.fromWireName(
                    requireString(resolution.get("resolution_strategy"), "resolution.resolution_strategy is required"));
        } catch (IllegalArgumentException e) {
            throw new InvalidAgentOutputException("resolution.resolution_strategy is invalid");
        }
        String rationaleHr = requireString(resolution.get("rationale_hr"), "resolution.rationale_hr is required");
        String rationaleEn = requireString(resolution.get("rationale_en"), "resolution.rationale_en is required");

        double confidence = requireNumber(arbitration.get("confidence"), "arbitration.confidence is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new InvalidAgentOutputException("arbitration.confidence must be between 0 and 1");
        }

        JsonNode review = arbitration.get("requires_human_review");
        if (review == null || !review.isBoolean()) {
            throw new InvalidAgentOutputException("arbitration.requires_human_review must be a boolean");
        }

        return new Arbitration(conflictId, conflictType, items, winningItemId, strategy, rationaleHr, rationaleEn,
                confidence, review.booleanValue(), optionalString(arbitration.get("human_review_reason")));
    }

    private JsonNode requireObject(JsonNode node, String message) {
        if (node == null || !node.isObject()) {
            throw new InvalidAgentOutputException(message);
        }
        return node;
    }

    private String requireString(JsonNode node, String message) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new InvalidAgentOutputException(message);
        }
        return node.asText();
    }

    private double requireNumber(JsonNode node, String message) {
        if (node == null || !node.isNumber()) {
            throw new InvalidAgentOutputException(message);
        }
        return node.doubleValue();
    }

    private <E extends Enum<E>> E requireEnum(JsonNode node, Class<E> type, String message) {
        String value = requireString(node, message);
        try {
            return Enum.valueOf(type, value.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidAgentOutputException(message + ": " + value);
        }
    }

    private String optionalString(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
