package io.regtruth.pipeline.fetch;

import io.regtruth.pipeline.domain.ContentClass;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Decides the content class of a response from its content type, URL extension and, for
 * PDFs served with a generic type, the file signature.
 */
@Component
public class ContentClassifier {

    private static final byte[] PDF_SIGNATURE = "%PDF".getBytes(StandardCharsets.US_ASCII);

    public ContentClass classify(String url, String contentType, byte[] body) {
        String type = contentType == null ? "" : contentType.toLowerCase(Locale.ROOT);
        String path = stripQuery(url == null ? "" : url.toLowerCase(Locale.ROOT));

        if (type.contains("pdf") || path.endsWith(".pdf") || startsWith(body, PDF_SIGNATURE)) {
            return ContentClass.PDF_TEXT;
        }
        if (type.contains("wordprocessingml") || path.endsWith(".docx")) {
            return ContentClass.DOCX;
        }
        if (type.contains("msword") || path.endsWith(".doc")) {
            return ContentClass.DOC;
        }
        if (type.contains("spreadsheetml") || path.endsWith(".xlsx")) {
            return ContentClass.XLSX;
        }
        if (type.contains("ms-excel") || path.endsWith(".xls")) {
            return ContentClass.XLS;
        }
        if (type.contains("json") || path.endsWith(".json")) {
            return ContentClass.JSON;
        }
        if (type.contains("html")) {
            return ContentClass.HTML;
        }
        if (type.contains("xml") || path.endsWith(".xml")) {
            return ContentClass.XML;
        }
        if (type.startsWith("text/") || (type.isEmpty() && looksLikePage(path))) {
            return ContentClass.HTML;
        }
        return ContentClass.UNKNOWN;
    }

    private static boolean looksLikePage(String path) {
        int slash = path.lastIndexOf('/');
        String lastSegment = slash >= 0 ? path.substring(slash + 1) : path;
        return lastSegment.endsWith(".html") || lastSegment.endsWith(".htm") || !lastSegment.contains(".");
    }

    private static boolean startsWith(byte[] body, byte[] prefix) {
        if (body == null || body.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (body[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static String stripQuery(String url) {
        int idx = url.indexOf('?');
        return idx >= 0 ? url.substring(0, idx) : url;
    }
}
