// IPageRenderer.java
package com.webdelta.core.api;

import com.webdelta.core.model.RenderOptions;
import com.webdelta.core.model.RenderedPage;
import com.webdelta.core.render.RenderException;

/** 페이지 렌더러 최소 계약: URL을 받아 렌더된 HTML과 링크를 돌려준다. */
public interface IPageRenderer extends AutoCloseable {

    RenderedPage render(String url, RenderOptions options) throws RenderException;

    /** 세션이 계속 쓸 만한지. false면 관리자가 폐기 후 재획득한다 */
    default boolean isHealthy() { return true; }

    @Override default void close() throws Exception {}
}
