package io.regtruth.pipeline.discovery.listing;

import io.regtruth.pipeline.discovery.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class HtmlLinkExtractor {

    /**
     * Absolute, normalized http(s) links matched by {@code selector}, in document order.
     */
    public List<String> extractLinks(String html, String baseUrl, String selector) {
        Document document = Jsoup.parse(html, baseUrl);
        List<String> links = new ArrayList<>();

        for (Element element : document.select(selector)) {
            String href = element.hasAttr("href") ? element.attr("abs:href") : element.select("a[href]").attr("abs:href");
            UrlNormalizer.normalize(href).ifPresent(links::add);
        }
        return links;
    }
}
