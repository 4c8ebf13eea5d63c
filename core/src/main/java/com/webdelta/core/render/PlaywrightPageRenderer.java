package com.webdelta.core.render;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import com.webdelta.core.api.IPageRenderer;
import com.webdelta.core.model.RenderOptions;
import com.webdelta.core.model.RenderedPage;
import com.webdelta.core.model.WaitStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 헤드리스 Chromium 렌더러(Playwright).
 * 브라우저 1개를 세션으로 공유하고, 렌더마다 viewport/UA를 반영한 새 페이지를 연다.
 * 브라우저 연결이 끊기면 isHealthy()=false → ManagedPageRenderer가 재기동한다.
 */
public final class PlaywrightPageRenderer implements IPageRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightPageRenderer.class);

    /** document.links 의 절대 href, 문서 순서 + 중복 제거 */
    private static final String LINKS_SCRIPT =
            "() => Array.from(new Set(Array.from(document.links).map(l => l.href)))";

    private final Playwright playwright;
    private final Browser browser;

    private PlaywrightPageRenderer(Playwright playwright, Browser browser) {
        this.playwright = playwright;
        this.browser = browser;
    }

    /** 브라우저 기동. 실패 시 부분 생성 자원 정리 후 예외 전파 */
    public static PlaywrightPageRenderer launch(boolean headless) {
        Playwright pw = Playwright.create();
        try {
            Browser br = pw.chromium().launch(new BrowserType.LaunchOptions()
                    .setHeadless(headless)
                    .setArgs(List.of("--no-sandbox", "--disable-setuid-sandbox", "--disable-dev-shm-usage")));
            LOG.info("Playwright browser launched (headless: {})", headless);
            return new PlaywrightPageRenderer(pw, br);
        } catch (RuntimeException e) {
            try {
                pw.close();
            } catch (RuntimeException ex) {
                LOG.trace("Error closing playwright after failed launch: {}", ex.getMessage());
            }
            throw e;
        }
    }

    @Override
    public RenderedPage render(String url, RenderOptions options) throws RenderException {
        Page page;
        try {
            page = browser.newPage(new Browser.NewPageOptions()
                    .setViewportSize(options.viewportWidth(), options.viewportHeight())
                    .setUserAgent(options.userAgent()));
        } catch (PlaywrightException e) {
            throw new RenderException(RenderException.Kind.NAVIGATION, url, "cannot open page: " + e.getMessage(), e);
        }
        try {
            page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(toWaitUntil(options.waitStrategy()))
                    .setTimeout(options.timeoutMs()));
            String html = page.content();
            Object raw = page.evaluate(LINKS_SCRIPT);
            return new RenderedPage(url, html, toLinks(raw));
        } catch (TimeoutError e) {
            throw new RenderException(RenderException.Kind.TIMEOUT, url, e.getMessage(), e);
        } catch (PlaywrightException e) {
            String msg = String.valueOf(e.getMessage());
            RenderException.Kind kind = msg.contains("net::ERR_")
                    ? RenderException.Kind.NETWORK
                    : RenderException.Kind.NAVIGATION;
            throw new RenderException(kind, url, msg, e);
        } finally {
            closePage(page);
        }
    }

    @Override
    public boolean isHealthy() {
        return browser.isConnected();
    }

    @Override
    public void close() {
        try {
            browser.close();
        } catch (PlaywrightException e) {
            LOG.debug("Browser already gone on close: {}", e.getMessage());
        }
        playwright.close();
        LOG.info("Playwright browser closed");
    }

    static WaitUntilState toWaitUntil(WaitStrategy w) {
        switch (w) {
            case LOAD: return WaitUntilState.LOAD;
            case DOMCONTENTLOADED: return WaitUntilState.DOMCONTENTLOADED;
            case NETWORKIDLE:
            default: return WaitUntilState.NETWORKIDLE;
        }
    }

    static List<String> toLinks(Object raw) {
        List<String> out = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object o : list) {
                if (o == null) continue;
                String s = o.toString();
                if (s.startsWith("http://") || s.startsWith("https://")) out.add(s);
            }
        }
        return out;
    }

    private static void closePage(Page page) {
        try {
            page.context().close();
        } catch (PlaywrightException e) {
            LOG.trace("Error closing page: {}", e.getMessage());
        }
    }
}
