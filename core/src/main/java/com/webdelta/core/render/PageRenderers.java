package com.webdelta.core.render;

import com.webdelta.core.model.CompareConfig;

/** 설정값(renderer:)에 맞는 렌더 세션 생성기 선택 */
public final class PageRenderers {
    private PageRenderers() {}

    public static PageRendererFactory factoryFor(CompareConfig cfg) {
        switch (cfg.getRenderer()) {
            case PLAYWRIGHT:
                boolean headless = cfg.getRender().isHeadless();
                return () -> PlaywrightPageRenderer.launch(headless);
            case JSOUP:
            default:
                return JsoupPageRenderer::new;
        }
    }
}
