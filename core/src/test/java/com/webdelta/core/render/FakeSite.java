package com.webdelta.core.render;

import com.webdelta.core.api.IPageRenderer;
import com.webdelta.core.model.RenderOptions;
import com.webdelta.core.model.RenderedPage;

import java.util.*;

/** 메모리 상 사이트 그래프를 렌더하는 가짜 렌더러 */
public final class FakeSite implements IPageRenderer {

    private final Map<String, String> titles = new LinkedHashMap<>();
    private final Map<String, List<String>> links = new LinkedHashMap<>();
    private final Map<String, String> rawHtml = new LinkedHashMap<>();
    private final Map<String, RenderException.Kind> failures = new HashMap<>();
    private final Set<String> breakers = new HashSet<>();
    private final List<String> rendered = new ArrayList<>();
    private boolean healthy = true;
    private boolean closed = false;

    public FakeSite page(String url, String title, String... outbound) {
        titles.put(url, title);
        links.put(url, List.of(outbound));
        return this;
    }

    /** 링크 없이 HTML을 그대로 돌려주는 페이지 */
    public FakeSite html(String url, String html, String... outbound) {
        rawHtml.put(url, html);
        links.put(url, List.of(outbound));
        return this;
    }

    public FakeSite failing(String url, RenderException.Kind kind) {
        failures.put(url, kind);
        return this;
    }

    /** 이 URL 렌더 시 실패하고 세션도 망가진다(브라우저 연결 끊김 흉내) */
    public FakeSite breaking(String url) {
        breakers.add(url);
        return this;
    }

    public FakeSite healthy(boolean v) { this.healthy = v; return this; }

    @Override
    public synchronized RenderedPage render(String url, RenderOptions options) throws RenderException {
        rendered.add(url);
        if (breakers.contains(url)) {
            healthy = false;
            throw new RenderException(RenderException.Kind.NETWORK, url, "session disconnected");
        }
        RenderException.Kind kind = failures.get(url);
        if (kind != null) throw new RenderException(kind, url, "simulated");
        if (!links.containsKey(url)) throw new RenderException(RenderException.Kind.NAVIGATION, url, "404");
        String html = rawHtml.containsKey(url)
                ? rawHtml.get(url)
                : "<html><head><title>" + titles.get(url) + "</title></head><body></body></html>";
        return new RenderedPage(url, html, links.get(url));
    }

    @Override public synchronized boolean isHealthy() { return healthy && !closed; }
    @Override public void close() { closed = true; }

    public synchronized List<String> rendered() { return List.copyOf(rendered); }
    public boolean isClosed() { return closed; }
}
