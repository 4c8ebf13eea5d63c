package com.webdelta.core.render;

/** 페이지 한 건의 렌더 실패. 크롤러가 페이지 단위로 복구한다 */
public class RenderException extends Exception {

    public enum Kind { TIMEOUT, NETWORK, NAVIGATION }

    private final Kind kind;
    private final String url;

    public RenderException(Kind kind, String url, String message) {
        this(kind, url, message, null);
    }

    public RenderException(Kind kind, String url, String message, Throwable cause) {
        super(kind + " " + url + ": " + message, cause);
        this.kind = kind;
        this.url = url;
    }

    public Kind getKind() { return kind; }
    public String getUrl() { return url; }
}
