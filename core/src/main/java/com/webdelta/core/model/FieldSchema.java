package com.webdelta.core.model;

import java.util.EnumSet;
import java.util.List;

/**
 * 추적 필드 스키마(버전/변형별 고정).
 * - FULL: 13개 전체
 * - REDUCED: quick 비교용 9개 (og:image, Twitter Card 계열 제외)
 */
public enum FieldSchema {
    FULL(List.of(SeoField.values())),
    REDUCED(List.of(
            SeoField.TITLE, SeoField.DESCRIPTION, SeoField.KEYWORDS,
            SeoField.H1, SeoField.H2, SeoField.CANONICAL, SeoField.ROBOTS,
            SeoField.OG_TITLE, SeoField.OG_DESCRIPTION));

    private final List<SeoField> fields;
    private final EnumSet<SeoField> lookup;

    FieldSchema(List<SeoField> fields) {
        this.fields = fields;
        this.lookup = EnumSet.copyOf(fields);
    }

    /** 비교/출력 순서가 곧 이 리스트 순서 */
    public List<SeoField> fields() { return fields; }
    public int size() { return fields.size(); }
    public boolean contains(SeoField f) { return f != null && lookup.contains(f); }
}
