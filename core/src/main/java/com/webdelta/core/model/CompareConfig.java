package com.webdelta.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 마이그레이션 비교 설정 (compare.yml 매핑 대상): 순수 설정 보관용.
 * CLI 플래그는 로딩 후 세터로 덮어쓴다.
 */
public final class CompareConfig {

    /** quick 모드의 사이트별 페이지 상한 */
    public static final int QUICK_MAX_PAGES = 10;

    /** 지원 출력 형식(소문자) */
    public static final Set<String> KNOWN_FORMATS = Set.of("json", "md", "snapshots");

    /** 렌더러 관련 하위 설정: YAML의 `render:` 섹션과 매핑 */
    public static final class RenderCfg {
        private int viewportWidth = 1920;
        private int viewportHeight = 1080;
        private String userAgent = RenderOptions.DEFAULT_USER_AGENT;
        private WaitStrategy waitStrategy = WaitStrategy.NETWORKIDLE;
        private Duration timeout = Duration.ofSeconds(30);   // 페이지당 타임아웃
        private boolean headless = true;                      // playwright 전용

        public int getViewportWidth() { return viewportWidth; }
        public RenderCfg setViewportWidth(int v) { this.viewportWidth = v; return this; }

        public int getViewportHeight() { return viewportHeight; }
        public RenderCfg setViewportHeight(int v) { this.viewportHeight = v; return this; }

        public String getUserAgent() { return userAgent; }
        public RenderCfg setUserAgent(String v) { this.userAgent = v; return this; }

        public WaitStrategy getWaitStrategy() { return waitStrategy; }
        public RenderCfg setWaitStrategy(WaitStrategy v) {
            this.waitStrategy = (v != null ? v : WaitStrategy.NETWORKIDLE);
            return this;
        }

        public Duration getTimeout() { return timeout; }
        public RenderCfg setTimeout(Duration v) { this.timeout = v; return this; }
        public RenderCfg setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }

        public boolean isHeadless() { return headless; }
        public RenderCfg setHeadless(boolean v) { this.headless = v; return this; }

        /** int ms 필요 시 편의 메서드 */
        public int getTimeoutMsInt() {
            long ms = timeout.toMillis();
            return (ms > Integer.MAX_VALUE) ? Integer.MAX_VALUE : (int) ms;
        }
    }

    // ---------- 기본 필드 ----------
    private String oldDomain;                 // 구 사이트 기준 URL (필수)
    private String newDomain;                 // 신규 사이트 기준 URL (필수)
    private Integer maxPages;                 // null이면 무제한
    private boolean quick = false;
    private FieldSchema schema = FieldSchema.FULL;
    private RendererKind renderer = RendererKind.JSOUP;
    private UrlMatching urlMatching = UrlMatching.EXACT;
    private boolean concurrentCrawls = false;
    private Path outputDir = Path.of("out");
    private List<String> formats = List.of("json", "md", "snapshots");

    /** YAML `render:` 섹션 매핑 */
    private RenderCfg render = new RenderCfg();

    // ---------- getters ----------
    public String getOldDomain() { return oldDomain; }
    public String getNewDomain() { return newDomain; }
    public Integer getMaxPages() { return maxPages; }
    public boolean isQuick() { return quick; }
    public FieldSchema getSchema() { return schema; }
    public RendererKind getRenderer() { return renderer; }
    public UrlMatching getUrlMatching() { return urlMatching; }
    public boolean isConcurrentCrawls() { return concurrentCrawls; }
    public Path getOutputDir() { return outputDir; }
    public List<String> getFormats() { return formats; }
    public RenderCfg getRender() { return render; }

    // ---------- fluent setters ----------
    public CompareConfig setOldDomain(String v) { this.oldDomain = v; return this; }
    public CompareConfig setNewDomain(String v) { this.newDomain = v; return this; }
    public CompareConfig setMaxPages(Integer v) { this.maxPages = v; return this; }
    public CompareConfig setQuick(boolean v) { this.quick = v; return this; }
    public CompareConfig setSchema(FieldSchema v) { this.schema = (v != null ? v : FieldSchema.FULL); return this; }
    public CompareConfig setRenderer(RendererKind v) { this.renderer = (v != null ? v : RendererKind.JSOUP); return this; }
    public CompareConfig setUrlMatching(UrlMatching v) { this.urlMatching = (v != null ? v : UrlMatching.EXACT); return this; }
    public CompareConfig setConcurrentCrawls(boolean v) { this.concurrentCrawls = v; return this; }
    public CompareConfig setOutputDir(Path v) { this.outputDir = v; return this; }
    public CompareConfig setRender(RenderCfg v) { this.render = (v != null ? v : new RenderCfg()); return this; }

    public CompareConfig setFormats(List<String> v) {
        if (v == null) return this;
        this.formats = v.stream().map(s -> s.trim().toLowerCase(Locale.ROOT)).filter(s -> !s.isEmpty()).toList();
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(oldDomain, "oldDomain");
        Objects.requireNonNull(newDomain, "newDomain");
        if (oldDomain.isBlank()) throw new IllegalArgumentException("oldDomain must not be blank");
        if (newDomain.isBlank()) throw new IllegalArgumentException("newDomain must not be blank");
        if (maxPages != null && maxPages < 0) throw new IllegalArgumentException("maxPages must be >= 0");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(formats, "formats");
        for (String f : formats) {
            if (!KNOWN_FORMATS.contains(f)) throw new IllegalArgumentException("unknown format: " + f);
        }

        Objects.requireNonNull(render, "render");
        if (render.getViewportWidth() <= 0 || render.getViewportHeight() <= 0)
            throw new IllegalArgumentException("render.viewport must be > 0");
        Duration t = render.getTimeout();
        if (t == null || t.isNegative() || t.isZero())
            throw new IllegalArgumentException("render.timeout must be > 0");
    }

    // ---------- helpers ----------
    public static CompareConfig defaults() { return new CompareConfig(); }

    /** 명시값 우선, 없으면 quick 여부로 결정. null = 무제한 */
    public Integer effectiveMaxPages() {
        if (maxPages != null) return maxPages;
        return quick ? QUICK_MAX_PAGES : null;
    }

    /** quick 모드는 축약 스키마 */
    public FieldSchema effectiveSchema() {
        return quick ? FieldSchema.REDUCED : schema;
    }

    public RenderOptions toRenderOptions() {
        return new RenderOptions(render.getViewportWidth(), render.getViewportHeight(),
                render.getUserAgent(), render.getWaitStrategy(), render.getTimeoutMsInt());
    }
}
