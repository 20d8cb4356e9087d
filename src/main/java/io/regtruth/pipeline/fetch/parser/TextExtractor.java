package io.regtruth.pipeline.fetch.parser;

import io.regtruth.pipeline.domain.ContentClass;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Plain text of textual responses, one trimmed non-empty line per block.
 */
@Component
public class TextExtractor {

    public String extract(String content, ContentClass contentClass) {
        if (content == null) {
            return "";
        }
        if (contentClass != ContentClass.HTML) {
            return content.strip();
        }

        Document document = Jsoup.parse(content);
        document.select("script, style, noscript").remove();
        String text = document.body() != null ? document.body().wholeText() : document.wholeText();

        return Arrays.stream(text.split("\\r?\\n"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }
}
