package io.regtruth.pipeline.discovery.listing;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class SitemapParser {

    public SitemapDocument parse(String xml) {
        Document document = Jsoup.parse(xml, "", Parser.xmlParser());
        boolean index = document.selectFirst("sitemapindex") != null;

        List<String> locations = new ArrayList<>();
        for (Element loc : document.select(index ? "sitemap > loc" : "url > loc")) {
            String text = loc.text().trim();
            if (!text.isEmpty()) {
                locations.add(text);
            }
        }
        return new SitemapDocument(index, locations);
    }

    /**
     * @param index     true for a sitemap index whose locations are further sitemaps
     * @param locations the {@code <loc>} values in document order
     */
    public record SitemapDocument(boolean index, List<String> locations) {}
}
