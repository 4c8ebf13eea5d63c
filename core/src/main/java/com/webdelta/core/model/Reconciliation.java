package com.webdelta.core.model;

import java.util.List;

/**
 * 두 도메인 URL 집합의 분류 결과.
 * @param missing  구 사이트 URL을 신규 도메인으로 치환했는데 신규 사이트에 없는 것(신규 도메인 기준)
 * @param newUrls  신규 사이트에만 있는 것
 * @param common   양쪽에 모두 있는 것(구 도메인 기준)
 */
public record Reconciliation(List<String> missing, List<String> newUrls, List<String> common) {
    public Reconciliation {
        missing = List.copyOf(missing);
        newUrls = List.copyOf(newUrls);
        common = List.copyOf(common);
    }
}
