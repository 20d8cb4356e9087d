package io.regtruth.pipeline.domain;

/**
 * Per-endpoint listing budgets and selectors. Zero or null values fall back to defaults.
 */
public record ListingOptions(
        int maxDepth,
        int maxUrls,
        int maxPages,
        String linkSelector,
        String urlPattern,
        String pageParam
) {
    public static final int DEFAULT_MAX_DEPTH = 4;
    public static final int DEFAULT_MAX_URLS = 2000;
    public static final int DEFAULT_MAX_PAGES = 10;

    public ListingOptions {
        maxDepth = maxDepth > 0 ? maxDepth : DEFAULT_MAX_DEPTH;
        maxUrls = maxUrls > 0 ? maxUrls : DEFAULT_MAX_URLS;
        maxPages = maxPages > 0 ? maxPages : DEFAULT_MAX_PAGES;
        linkSelector = linkSelector == null || linkSelector.isBlank() ? "a[href]" : linkSelector;
        pageParam = pageParam == null || pageParam.isBlank() ? "page" : pageParam;
    }

    public static ListingOptions defaults() {
        return new ListingOptions(0, 0, 0, null, null, null);
    }
}
