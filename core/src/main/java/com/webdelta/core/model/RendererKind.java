package com.webdelta.core.model;

/** 페이지 렌더러 구현 선택 */
public enum RendererKind {
    /** 정적 HTML(jsoup). 자바스크립트 실행 없음 */
    JSOUP,
    /** 헤드리스 Chromium(Playwright) */
    PLAYWRIGHT
}
