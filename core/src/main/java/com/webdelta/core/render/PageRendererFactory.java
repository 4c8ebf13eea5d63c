package com.webdelta.core.render;

import com.webdelta.core.api.IPageRenderer;

/** 렌더 세션 생성기. 실패 시 예외를 던지면 관리자가 RendererUnavailableException으로 감싼다 */
@FunctionalInterface
public interface PageRendererFactory {
    IPageRenderer create() throws Exception;
}
