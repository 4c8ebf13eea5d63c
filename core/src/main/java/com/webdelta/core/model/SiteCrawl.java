package com.webdelta.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 사이트 한 곳의 크롤 결과.
 * - urls: 페이지에서 링크로 발견된 범위 내 URL(발견 순서, 중복 없음)
 * - snapshots: 실제 렌더에 성공한 URL → HTML
 * - failedUrls: 방문했지만 렌더에 실패한 URL
 */
public final class SiteCrawl {
    private final String baseUrl;
    private final List<String> urls;
    private final Map<String, String> snapshots;
    private final List<String> failedUrls;

    public SiteCrawl(String baseUrl, List<String> urls, List<PageSnapshot> pages, List<String> failedUrls) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.urls = List.copyOf(urls);
        Map<String, String> m = new LinkedHashMap<>();
        for (PageSnapshot p : pages) m.putIfAbsent(p.url(), p.html());
        this.snapshots = Collections.unmodifiableMap(m);
        this.failedUrls = List.copyOf(failedUrls);
    }

    public String getBaseUrl() { return baseUrl; }
    public List<String> getUrls() { return urls; }
    public Map<String, String> getSnapshots() { return snapshots; }
    public List<String> getFailedUrls() { return failedUrls; }

    public Optional<String> snapshot(String url) {
        return Optional.ofNullable(snapshots.get(url));
    }

    public int visitedCount() { return snapshots.size() + failedUrls.size(); }
}
