package com.webdelta.core.model;

import java.util.Objects;

/** 캡처된 페이지 한 장(불변) */
public record PageSnapshot(String url, String html) {
    public PageSnapshot {
        Objects.requireNonNull(url, "url");
        html = html == null ? "" : html;
    }
}
