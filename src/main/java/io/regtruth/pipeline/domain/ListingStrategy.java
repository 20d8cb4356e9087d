package io.regtruth.pipeline.domain;

public enum ListingStrategy {
    SITEMAP_XML,
    CRAWL,
    PAGINATION,
    HTML_LIST,
    RSS_FEED
}
