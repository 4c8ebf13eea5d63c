package com.webdelta.core.service;

import com.webdelta.core.crawler.Crawler;
import com.webdelta.core.diff.FieldDiffer;
import com.webdelta.core.diff.UrlReconciler;
import com.webdelta.core.extract.FieldExtractor;
import com.webdelta.core.model.CompareConfig;
import com.webdelta.core.model.ComparisonResult;
import com.webdelta.core.model.FieldRecord;
import com.webdelta.core.model.MigrationReport;
import com.webdelta.core.model.Reconciliation;
import com.webdelta.core.model.RenderOptions;
import com.webdelta.core.model.SiteCrawl;
import com.webdelta.core.render.ManagedPageRenderer;
import com.webdelta.core.render.PageRendererFactory;
import com.webdelta.core.render.PageRenderers;
import com.webdelta.core.util.ProgressListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 마이그레이션 비교 오케스트레이터:
 *  - crawl(old) → crawl(new) → reconcile → extract → diff → aggregate
 *  - 두 사이트 크롤은 상태를 공유하지 않으므로 concurrentCrawls=true면 병렬 실행 후 합류
 *  - DI 생성자는 테스트용(가짜 렌더러/추출기/시계 주입)
 *
 * 렌더 세션 획득 실패(RendererUnavailableException)만 치명 오류로 전파되고,
 * 페이지 단위 실패는 크롤러/추출기 안에서 복구된다.
 */
public final class MigrationCompareService {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationCompareService.class);

    private final CompareConfig config;
    private final PageRendererFactory rendererFactory;
    private final FieldExtractor extractor;
    private final FieldDiffer differ = new FieldDiffer();
    private final UrlReconciler reconciler;
    private final Clock clock;

    /** 기본 구현(설정의 renderer: 값 사용) */
    public MigrationCompareService(CompareConfig config) {
        this(config, PageRenderers.factoryFor(config));
    }

    public MigrationCompareService(CompareConfig config, PageRendererFactory rendererFactory) {
        this(config, rendererFactory, new FieldExtractor(config.effectiveSchema()), Clock.systemUTC());
    }

    /** DI/테스트용 */
    public MigrationCompareService(CompareConfig config, PageRendererFactory rendererFactory,
                                   FieldExtractor extractor, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.rendererFactory = Objects.requireNonNull(rendererFactory, "rendererFactory");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reconciler = new UrlReconciler(config.getUrlMatching());
    }

    public CompareOutcome run() {
        return run(ProgressListener.NONE);
    }

    public CompareOutcome run(ProgressListener listener) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final long started = clock.millis();
        final String oldDomain = config.getOldDomain();
        final String newDomain = config.getNewDomain();
        final Integer maxPages = config.effectiveMaxPages();

        LOG.info("Starting website migration comparison: old={}, new={}, maxPages={}, schema={}, renderer={}",
                oldDomain, newDomain, maxPages == null ? "unbounded" : maxPages,
                config.effectiveSchema(), config.getRenderer());

        // ---- 1) 두 사이트 크롤 ----
        SiteCrawl[] crawls = config.isConcurrentCrawls()
                ? crawlConcurrently(oldDomain, newDomain, maxPages, pl)
                : crawlSequentially(oldDomain, newDomain, maxPages, pl);
        SiteCrawl oldCrawl = crawls[0];
        SiteCrawl newCrawl = crawls[1];

        // ---- 2) URL 분류 ----
        Reconciliation rec = reconciler.reconcile(oldCrawl.getUrls(), oldDomain, newCrawl.getUrls(), newDomain);
        LOG.info("Reconciled: missing={}, new={}, common={}",
                rec.missing().size(), rec.newUrls().size(), rec.common().size());

        // ---- 3) 공통 페이지 비교 ----
        List<ComparisonResult> comparisons = new ArrayList<>();
        List<String> extractionFailures = new ArrayList<>();
        int total = rec.common().size();
        int done = 0;
        for (String oldUrl : rec.common()) {
            String newUrl = reconciler.counterpart(oldUrl, oldDomain, newCrawl.getUrls(), newDomain);
            pl.onProgress(total == 0 ? 1.0 : (double) done / total, "compare", done, total);
            done++;

            Optional<String> oldHtml = oldCrawl.snapshot(oldUrl);
            Optional<String> newHtml = newCrawl.snapshot(newUrl);
            if (oldHtml.isEmpty() || newHtml.isEmpty()) {
                // 발견만 되고 방문 못 한(예산/실패) 페이지
                LOG.debug("No snapshot pair for {} / {}, skipping comparison", oldUrl, newUrl);
                continue;
            }

            FieldRecord oldRecord = extractor.extract(oldHtml.get());
            FieldRecord newRecord = extractor.extract(newHtml.get());
            if (oldRecord.isExtractionFailed() || newRecord.isExtractionFailed()) {
                LOG.warn("Extraction failed for {}, reporting as extraction failure instead of diff", newUrl);
                extractionFailures.add(newUrl);
                continue;
            }
            comparisons.add(differ.compare(oldRecord, newRecord, newUrl));
        }
        pl.onProgress(1.0, "compare", total, total);

        // ---- 4) 집계 ----
        long duration = clock.millis() - started;
        MigrationReport report = new ReportAggregator(config.effectiveSchema(), clock)
                .aggregate(oldCrawl, newCrawl, rec, comparisons, extractionFailures, duration);

        MigrationReport.Summary s = report.getSummary();
        LOG.info("Comparison complete: oldUrls={}, newUrls={}, missing={}, new={}, pagesWithChanges={}, extractionFailures={}",
                s.oldWebsiteUrls(), s.newWebsiteUrls(), s.missingUrls(), s.newUrls(),
                s.pagesWithChanges(), s.extractionFailures());
        return new CompareOutcome(oldCrawl, newCrawl, report);
    }

    // ---------- crawl scheduling ----------

    /** 렌더 세션 하나를 두 사이트가 차례로 사용 */
    private SiteCrawl[] crawlSequentially(String oldDomain, String newDomain, Integer maxPages, ProgressListener pl) {
        try (ManagedPageRenderer renderer = new ManagedPageRenderer(rendererFactory)) {
            renderer.warmUp(); // 세션 획득 불가면 여기서 치명 오류
            RenderOptions opts = config.toRenderOptions();

            LOG.info("=== Crawling Old Website ===");
            SiteCrawl oldCrawl = new Crawler(renderer, opts, pl, "crawl-old").crawl(oldDomain, maxPages);

            LOG.info("=== Crawling New Website ===");
            SiteCrawl newCrawl = new Crawler(renderer, opts, pl, "crawl-new").crawl(newDomain, maxPages);
            return new SiteCrawl[] { oldCrawl, newCrawl };
        }
    }

    /** 사이트별 독립 세션 + 워커 2개, 둘 다 끝난 뒤 합류 */
    private SiteCrawl[] crawlConcurrently(String oldDomain, String newDomain, Integer maxPages, ProgressListener pl) {
        ExecutorService exec = Executors.newFixedThreadPool(2, new NamedThreadFactory("crawl-worker"));
        try {
            Future<SiteCrawl> oldF = exec.submit(() -> crawlOwnSession(oldDomain, maxPages, pl, "crawl-old"));
            Future<SiteCrawl> newF = exec.submit(() -> crawlOwnSession(newDomain, maxPages, pl, "crawl-new"));
            return new SiteCrawl[] { join(oldF), join(newF) };
        } finally {
            exec.shutdownNow();
        }
    }

    private SiteCrawl crawlOwnSession(String domain, Integer maxPages, ProgressListener pl, String phase) {
        try (ManagedPageRenderer renderer = new ManagedPageRenderer(rendererFactory)) {
            renderer.warmUp();
            return new Crawler(renderer, config.toRenderOptions(), pl, phase).crawl(domain, maxPages);
        }
    }

    private static SiteCrawl join(Future<SiteCrawl> f) {
        try {
            return f.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for crawl", ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Crawl failed: " + cause, cause);
        }
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
