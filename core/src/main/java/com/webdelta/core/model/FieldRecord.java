package com.webdelta.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 스키마 고정 필드 레코드.
 * 스키마의 모든 필드를 정확히 한 번씩 가진다. 값이 없으면 빈 문자열(null 없음).
 * extractionFailed 는 필드가 아닌 표식: 추출 실패로 만들어진 빈 레코드임을 뜻한다.
 */
public final class FieldRecord {
    private final FieldSchema schema;
    private final Map<SeoField, String> values;
    private final boolean extractionFailed;

    private FieldRecord(FieldSchema schema, Map<SeoField, String> values, boolean extractionFailed) {
        this.schema = schema;
        this.values = Collections.unmodifiableMap(values);
        this.extractionFailed = extractionFailed;
    }

    public FieldSchema schema() { return schema; }
    public boolean isExtractionFailed() { return extractionFailed; }
    public int size() { return values.size(); }

    public String get(SeoField field) {
        if (!schema.contains(field)) {
            throw new IllegalArgumentException(field + " is not part of schema " + schema);
        }
        return values.get(field);
    }

    /** key → value, 스키마 순서 */
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (SeoField f : schema.fields()) out.put(f.key(), values.get(f));
        return out;
    }

    /** 모든 값이 빈 문자열인 레코드 */
    public static FieldRecord empty(FieldSchema schema) {
        return builder(schema).build();
    }

    /** 추출 실패 대체용 레코드 */
    public static FieldRecord failed(FieldSchema schema) {
        return builder(schema).extractionFailed(true).build();
    }

    public static Builder builder(FieldSchema schema) { return new Builder(schema); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldRecord other)) return false;
        return schema == other.schema
                && extractionFailed == other.extractionFailed
                && values.equals(other.values);
    }

    @Override
    public int hashCode() { return Objects.hash(schema, values, extractionFailed); }

    @Override
    public String toString() {
        return "FieldRecord{" + schema + (extractionFailed ? ", FAILED" : "") + ", " + asMap() + "}";
    }

    public static final class Builder {
        private final FieldSchema schema;
        private final EnumMap<SeoField, String> values = new EnumMap<>(SeoField.class);
        private boolean extractionFailed;

        private Builder(FieldSchema schema) {
            this.schema = Objects.requireNonNull(schema, "schema");
        }

        public Builder put(SeoField field, String value) {
            if (!schema.contains(field)) {
                throw new IllegalArgumentException(field + " is not part of schema " + schema);
            }
            values.put(field, value == null ? "" : value);
            return this;
        }

        public Builder extractionFailed(boolean v) { this.extractionFailed = v; return this; }

        public FieldRecord build() {
            EnumMap<SeoField, String> out = new EnumMap<>(SeoField.class);
            for (SeoField f : schema.fields()) out.put(f, values.getOrDefault(f, ""));
            return new FieldRecord(schema, out, extractionFailed);
        }
    }
}
