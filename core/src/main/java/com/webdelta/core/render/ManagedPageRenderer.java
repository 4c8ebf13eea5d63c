package com.webdelta.core.render;

import com.webdelta.core.api.IPageRenderer;
import com.webdelta.core.model.RenderOptions;
import com.webdelta.core.model.RenderedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 렌더 세션을 관리 자원으로 감싼 래퍼.
 * - 첫 사용 시 지연 획득(lazy acquire)
 * - 매 렌더 직전 isHealthy() 확인, 망가졌으면 닫고 새로 획득
 * - 실패한 진행 중 페이지는 재시도하지 않음(호출자 몫)
 * 획득 자체가 실패하면 RendererUnavailableException(치명).
 */
public final class ManagedPageRenderer implements IPageRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(ManagedPageRenderer.class);

    private final PageRendererFactory factory;
    private IPageRenderer delegate;
    private int acquisitions = 0;

    public ManagedPageRenderer(PageRendererFactory factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public synchronized RenderedPage render(String url, RenderOptions options) throws RenderException {
        return acquire().render(url, options);
    }

    /** 세션을 미리 확보해 설정 오류를 조기에 드러낸다 */
    public synchronized void warmUp() {
        acquire();
    }

    /** 아직 획득 전이면 건강한 것으로 본다(다음 사용 시 획득) */
    @Override
    public synchronized boolean isHealthy() {
        return delegate == null || delegate.isHealthy();
    }

    /** 누적 획득 횟수(재초기화 포함) */
    public synchronized int getAcquisitions() { return acquisitions; }

    private IPageRenderer acquire() {
        if (delegate != null) {
            if (delegate.isHealthy()) return delegate;
            LOG.warn("Renderer session is no longer usable, reinitializing (acquisition #{})", acquisitions + 1);
            closeDelegate();
        }
        try {
            delegate = factory.create();
        } catch (Exception e) {
            throw new RendererUnavailableException("Cannot acquire a renderer session: " + e.getMessage(), e);
        }
        if (delegate == null) {
            throw new RendererUnavailableException("Renderer factory returned null", null);
        }
        acquisitions++;
        LOG.debug("Renderer session acquired: {}", delegate.getClass().getSimpleName());
        return delegate;
    }

    private void closeDelegate() {
        IPageRenderer old = delegate;
        delegate = null;
        try {
            old.close();
        } catch (Exception e) {
            LOG.warn("Error closing broken renderer session: {}", e.getMessage());
        }
    }

    @Override
    public synchronized void close() {
        if (delegate != null) closeDelegate();
    }
}
