package io.regtruth.pipeline.discovery;

import io.regtruth.pipeline.domain.FreshnessRisk;
import io.regtruth.pipeline.domain.NodeRole;
import io.regtruth.pipeline.domain.NodeType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * URL heuristics for node type, role and freshness risk of newly discovered pages.
 */
@Component
public class UrlClassifier {

    private static final List<String> ASSET_EXTENSIONS = List.of(
            ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".zip", ".xml", ".json");

    private static final List<String> NEWS_MARKERS = List.of("/novosti", "/vijesti", "/news", "/priopcenja");
    private static final List<String> GUIDANCE_MARKERS = List.of("/upute", "/misljenja", "/guidance", "/vodic");
    private static final List<String> FORM_MARKERS = List.of("/obrasci", "/forms");
    private static final List<String> ARCHIVE_MARKERS = List.of("/arhiva", "/archive");

    public UrlClassification classify(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        String path = stripQuery(lower);

        if (ASSET_EXTENSIONS.stream().anyMatch(path::endsWith)) {
            return new UrlClassification(NodeType.ASSET, null, FreshnessRisk.MEDIUM);
        }
        if (lower.contains("narodne-novine") && lower.contains("sluzbeni")) {
            return new UrlClassification(NodeType.LEAF, NodeRole.REGULATION, FreshnessRisk.CRITICAL);
        }
        if (containsAny(path, NEWS_MARKERS)) {
            return new UrlClassification(NodeType.HUB, NodeRole.NEWS_FEED, FreshnessRisk.HIGH);
        }
        if (containsAny(path, GUIDANCE_MARKERS)) {
            return new UrlClassification(NodeType.LEAF, NodeRole.GUIDANCE, FreshnessRisk.HIGH);
        }
        if (containsAny(path, FORM_MARKERS)) {
            return new UrlClassification(NodeType.LEAF, NodeRole.FORM, FreshnessRisk.MEDIUM);
        }
        if (containsAny(path, ARCHIVE_MARKERS)) {
            return new UrlClassification(NodeType.HUB, NodeRole.ARCHIVE, FreshnessRisk.LOW);
        }
        return new UrlClassification(NodeType.LEAF, null, FreshnessRisk.MEDIUM);
    }

    private static boolean containsAny(String value, List<String> markers) {
        return markers.stream().anyMatch(value::contains);
    }

    private static String stripQuery(String url) {
        int idx = url.indexOf('?');
        return idx >= 0 ? url.substring(0, idx) : url;
    }
}
