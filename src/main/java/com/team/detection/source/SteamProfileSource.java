package com.team.detection.source;

import java.util.Objects;

/**
 * {@link ProfileSource} for Steam Community profiles. All pages are requested in English
 * so that the extraction patterns stay stable.
 */
public class SteamProfileSource implements ProfileSource {

    public static final String DEFAULT_BASE_URL = "https://steamcommunity.com";

    private final PageFetcher fetcher;
    private final String baseUrl;

    public SteamProfileSource(PageFetcher fetcher) {
        this(fetcher, DEFAULT_BASE_URL);
    }

    public SteamProfileSource(PageFetcher fetcher, String baseUrl) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl is required"));
    }

    @Override
    public String fetchProfile(String numericId) {
        return fetcher.fetch(baseUrl + "/profiles/" + numericId + "/?l=english");
    }

    @Override
    public String fetchProfileByAlias(String aliasId) {
        return fetcher.fetch(baseUrl + "/id/" + aliasId + "/?l=english");
    }

    @Override
    public String fetchRelationshipList(String numericId) {
        return fetcher.fetch(baseUrl + "/profiles/" + numericId + "/friends/?l=english");
    }

    @Override
    public String fetchAnnotationsPage(String numericId, int page) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        return fetcher.fetch(baseUrl + "/profiles/" + numericId + "/allcomments/?l=english&ctp=" + page);
    }

    @Override
    public String profileLink(String numericId) {
        return baseUrl + "/profiles/" + numericId + "/?l=english";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
