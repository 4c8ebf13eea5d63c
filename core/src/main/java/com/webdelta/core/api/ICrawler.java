// ICrawler.java
package com.webdelta.core.api;

import com.webdelta.core.model.SiteCrawl;

/** 크롤러 최소 계약: 기준 URL 아래 페이지를 모아 스냅샷 집합을 돌려준다. */
public interface ICrawler extends AutoCloseable {
    /**
     * @param baseUrl  범위 판정용 접두어이자 시작 URL
     * @param maxPages 방문 상한(null이면 무제한)
     */
    SiteCrawl crawl(String baseUrl, Integer maxPages);
    @Override default void close() throws Exception {}
}
