package io.regtruth.pipeline.fetch;

import org.apache.commons.codec.digest.DigestUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Node;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * SHA-256 content fingerprints. HTML is normalized first so that comment and whitespace
 * churn does not register as a change; everything else is hashed byte for byte.
 */
public final class ContentHasher {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ContentHasher() {
    }

    public static String hashContent(String content, String contentType) {
        String value = content == null ? "" : content;
        if (isHtml(contentType)) {
            value = normalizeHtml(value);
        }
        return DigestUtils.sha256Hex(value);
    }

    public static String hashBytes(byte[] content) {
        return DigestUtils.sha256Hex(content == null ? new byte[0] : content);
    }

    /**
     * A missing previous hash counts as a change.
     */
    public static boolean hasChanged(String previousHash, String currentHash) {
        return previousHash == null || !previousHash.equals(currentHash);
    }

    static String normalizeHtml(String html) {
        Document document = Jsoup.parse(html);
        document.outputSettings().prettyPrint(false);

        List<Node> comments = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Comment) {
                comments.add(node);
            }
        }, document);
        comments.forEach(Node::remove);

        return WHITESPACE.matcher(document.outerHtml()).replaceAll(" ").trim();
    }

    private static boolean isHtml(String contentType) {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("html");
    }
}
