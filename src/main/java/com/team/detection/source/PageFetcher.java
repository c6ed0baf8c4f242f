package com.team.detection.source;

/**
 * Fetches the body of a page.
 */
@FunctionalInterface
public interface PageFetcher {

    /**
     * Fetches the page at the given URL.
     *
     * @param url absolute URL
     * @return the response body
     * @throws TransportException if the request fails or the status is not successful
     */
    String fetch(String url);
}
