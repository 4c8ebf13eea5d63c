package com.webdelta.core.crawler;

import com.webdelta.core.api.ICrawler;
import com.webdelta.core.api.IPageRenderer;
import com.webdelta.core.model.PageSnapshot;
import com.webdelta.core.model.RenderOptions;
import com.webdelta.core.model.RenderedPage;
import com.webdelta.core.model.SiteCrawl;
import com.webdelta.core.render.RenderException;
import com.webdelta.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * DFS(명시적 워크리스트) 기반 Crawler
 * - baseUrl 접두어 범위 / 중복 방지 / 페이지 예산(maxPages)
 * - 렌더는 IPageRenderer에 위임, 페이지 단위 실패는 건너뛰고 계속
 * - 렌더 실패 페이지도 방문으로 계산(같은 세션 내 재시도 없음)
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);

    private final IPageRenderer renderer;
    private final RenderOptions options;
    private final ProgressListener progress;
    private final String phase;

    public Crawler(IPageRenderer renderer, RenderOptions options) {
        this(renderer, options, ProgressListener.NONE, "crawl");
    }

    public Crawler(IPageRenderer renderer, RenderOptions options, ProgressListener progress, String phase) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.options = Objects.requireNonNull(options, "options");
        this.progress = (progress != null) ? progress : ProgressListener.NONE;
        this.phase = (phase != null) ? phase : "crawl";
    }

    @Override
    public SiteCrawl crawl(String baseUrl, Integer maxPages) {
        CrawlSession s = new CrawlSession(baseUrl, maxPages);
        LOG.info("Crawl start: base={}, maxPages={}", baseUrl, maxPages == null ? "unbounded" : maxPages);

        String url;
        while ((url = s.next()) != null) {
            if (!s.budgetLeft()) break;       // 예산 소진 → 종료
            if (!s.shouldVisit(url)) continue;

            s.markVisited(url);
            LOG.info("Crawling: {}", url);
            progress.onProgress(fraction(s.visitedCount(), maxPages), phase,
                    s.visitedCount(), maxPages == null ? -1 : maxPages);

            RenderedPage page;
            try {
                page = renderer.render(url, options);
            } catch (RenderException e) {
                // 해당 페이지만 건너뜀. 링크는 추가하지 않는다
                LOG.warn("Error crawling {} ({}): {}", url, e.getKind(), e.getMessage());
                s.fail(url);
                continue;
            }

            s.capture(new PageSnapshot(url, page.getHtml()));
            List<String> links = s.discover(page.getOutboundLinks());
            s.pushAll(links);
        }

        SiteCrawl result = s.toResult();
        LOG.info("Crawl done: base={}, visited={}, captured={}, failed={}, discovered={}",
                baseUrl, s.visitedCount(), result.getSnapshots().size(),
                result.getFailedUrls().size(), result.getUrls().size());
        return result;
    }

    /** 상한이 없으면 진행률을 알 수 없으므로 0 */
    static double fraction(int visited, Integer maxPages) {
        if (maxPages == null || maxPages <= 0) return 0.0;
        return Math.min(1.0, (double) visited / maxPages);
    }

    @Override
    public void close() throws Exception {
        renderer.close();
    }
}
