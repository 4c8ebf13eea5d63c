package com.webdelta.core.model;

import java.util.List;
import java.util.Objects;

/** 렌더러 출력: 렌더된 HTML + 페이지 내 링크(절대 URL, 문서 순서, 중복 제거) */
public final class RenderedPage {
    private final String url;
    private final String html;
    private final List<String> outboundLinks;

    public RenderedPage(String url, String html, List<String> outboundLinks) {
        this.url = Objects.requireNonNull(url, "url");
        this.html = html == null ? "" : html;
        this.outboundLinks = List.copyOf(outboundLinks == null ? List.of() : outboundLinks);
    }

    public String getUrl() { return url; }
    public String getHtml() { return html; }
    public List<String> getOutboundLinks() { return outboundLinks; }
}
