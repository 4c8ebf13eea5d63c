package com.webdelta.core.model;

import java.util.Objects;

/** 렌더 요청 한 건의 옵션(불변) */
public record RenderOptions(int viewportWidth,
                            int viewportHeight,
                            String userAgent,
                            WaitStrategy waitStrategy,
                            int timeoutMs) {

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

    public RenderOptions {
        Objects.requireNonNull(waitStrategy, "waitStrategy");
        if (viewportWidth <= 0 || viewportHeight <= 0)
            throw new IllegalArgumentException("viewport must be positive");
        if (timeoutMs <= 0) throw new IllegalArgumentException("timeoutMs must be > 0");
        if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
    }

    public static RenderOptions defaults() {
        return new RenderOptions(1920, 1080, DEFAULT_USER_AGENT, WaitStrategy.NETWORKIDLE, 30_000);
    }
}
