package com.webdelta.core.render;

/** 렌더 세션을 획득할 수 없음. 실행 전체를 중단시키는 치명 오류 */
public class RendererUnavailableException extends RuntimeException {
    public RendererUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
