package com.team.detection.fixtures;

import com.team.detection.source.PageFetcher;
import com.team.detection.source.TransportException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link PageFetcher} serving registered pages. Unknown URLs fail with status 404.
 * Every request is recorded, including failed ones.
 */
public class FixturePageFetcher implements PageFetcher {

    private final Map<String, String> pages = new HashMap<>();
    private final List<String> requests = new CopyOnWriteArrayList<>();

    public FixturePageFetcher register(String url, String content) {
        pages.put(url, content);
        return this;
    }

    @Override
    public String fetch(String url) {
        requests.add(url);
        String content = pages.get(url);
        if (content == null) {
            throw new TransportException(url, 404);
        }
        return content;
    }

    public List<String> getRequests() {
        return List.copyOf(requests);
    }

    public long requestCount(String url) {
        return requests.stream().filter(url::equals).count();
    }

    public long requestCountContaining(String fragment) {
        return requests.stream().filter(r -> r.contains(fragment)).count();
    }
}
