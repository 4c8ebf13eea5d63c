package com.webdelta.core.crawler;

import com.webdelta.core.model.PageSnapshot;
import com.webdelta.core.model.SiteCrawl;
import com.webdelta.core.util.UrlUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 사이트 크롤 1회분 상태. 크롤 종료 후 SiteCrawl로 굳히고 버린다.
 * 단일 스레드 전용(동기화 없음).
 */
final class CrawlSession {

    private final String baseUrl;
    private final Integer maxPages;                           // null = 무제한
    private final Set<String> visited = new LinkedHashSet<>();
    private final Deque<String> frontier = new ArrayDeque<>();  // LIFO 워크리스트
    private final Set<String> discovered = new LinkedHashSet<>();
    private final List<PageSnapshot> pages = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();

    CrawlSession(String baseUrl, Integer maxPages) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        if (maxPages != null && maxPages < 0) throw new IllegalArgumentException("maxPages must be >= 0");
        this.maxPages = maxPages;
        frontier.push(baseUrl);
    }

    boolean budgetLeft() {
        return maxPages == null || visited.size() < maxPages;
    }

    /** 다음 방문 후보. 없으면 null */
    String next() {
        return frontier.poll();
    }

    boolean shouldVisit(String url) {
        return !visited.contains(url) && UrlUtils.inScope(url, baseUrl);
    }

    void markVisited(String url) { visited.add(url); }
    int visitedCount() { return visited.size(); }

    void capture(PageSnapshot snapshot) { pages.add(snapshot); }
    void fail(String url) { failed.add(url); }

    /** 범위 내 링크만 발견 집합에 넣고, 그 목록을 돌려준다(페이지 순서) */
    List<String> discover(List<String> links) {
        List<String> scoped = new ArrayList<>();
        Set<String> seenOnPage = new LinkedHashSet<>();
        for (String l : links) {
            if (!UrlUtils.inScope(l, baseUrl)) continue;
            if (!seenOnPage.add(l)) continue;
            scoped.add(l);
            discovered.add(l);
        }
        return scoped;
    }

    /** 페이지의 첫 링크가 다음에 꺼내지도록 역순으로 적재 */
    void pushAll(List<String> links) {
        for (int i = links.size() - 1; i >= 0; i--) {
            String l = links.get(i);
            if (!visited.contains(l)) frontier.push(l);
        }
    }

    SiteCrawl toResult() {
        return new SiteCrawl(baseUrl, new ArrayList<>(discovered), pages, failed);
    }
}
