package com.webdelta.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 한 번의 마이그레이션 비교 결과(불변). 영속화는 호출자(Exporter) 몫 */
public final class MigrationReport {

    /** 실행 메타 */
    public record Metadata(Instant timestamp, String oldDomain, String newDomain,
                           FieldSchema schema, long durationMs) {
        public Metadata {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(oldDomain, "oldDomain");
            Objects.requireNonNull(newDomain, "newDomain");
            Objects.requireNonNull(schema, "schema");
        }
    }

    /** 요약 카운트 */
    public record Summary(int oldWebsiteUrls, int newWebsiteUrls, int missingUrls,
                          int newUrls, int pagesWithChanges, int extractionFailures) {}

    private final Metadata metadata;
    private final Summary summary;
    private final List<String> missingUrls;
    private final List<String> newUrls;
    private final List<ComparisonResult> pageComparisons;
    private final Map<SeoField, Integer> fieldImpact;
    private final List<String> extractionFailures;

    private MigrationReport(Builder b) {
        this.metadata = b.metadata;
        this.summary = b.summary;
        this.missingUrls = List.copyOf(b.missingUrls);
        this.newUrls = List.copyOf(b.newUrls);
        this.pageComparisons = List.copyOf(b.pageComparisons);
        this.fieldImpact = Collections.unmodifiableMap(new LinkedHashMap<>(b.fieldImpact));
        this.extractionFailures = List.copyOf(b.extractionFailures);
    }

    public Metadata getMetadata() { return metadata; }
    public Summary getSummary() { return summary; }
    public List<String> getMissingUrls() { return missingUrls; }
    public List<String> getNewUrls() { return newUrls; }
    public List<ComparisonResult> getPageComparisons() { return pageComparisons; }
    /** 스키마 순서, 변경 0건 필드 포함 */
    public Map<SeoField, Integer> getFieldImpact() { return fieldImpact; }
    public List<String> getExtractionFailures() { return extractionFailures; }

    public int impactOf(SeoField field) { return fieldImpact.getOrDefault(field, 0); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private Metadata metadata;
        private Summary summary;
        private List<String> missingUrls = List.of();
        private List<String> newUrls = List.of();
        private List<ComparisonResult> pageComparisons = List.of();
        private Map<SeoField, Integer> fieldImpact = Map.of();
        private List<String> extractionFailures = List.of();

        public Builder metadata(Metadata m) { this.metadata = m; return this; }
        public Builder summary(Summary s) { this.summary = s; return this; }
        public Builder missingUrls(List<String> v) { this.missingUrls = v; return this; }
        public Builder newUrls(List<String> v) { this.newUrls = v; return this; }
        public Builder pageComparisons(List<ComparisonResult> v) { this.pageComparisons = v; return this; }
        public Builder fieldImpact(Map<SeoField, Integer> v) { this.fieldImpact = v; return this; }
        public Builder extractionFailures(List<String> v) { this.extractionFailures = v; return this; }

        public MigrationReport build() {
            Objects.requireNonNull(metadata, "metadata");
            Objects.requireNonNull(summary, "summary");
            Objects.requireNonNull(missingUrls, "missingUrls");
            Objects.requireNonNull(newUrls, "newUrls");
            Objects.requireNonNull(pageComparisons, "pageComparisons");
            Objects.requireNonNull(fieldImpact, "fieldImpact");
            Objects.requireNonNull(extractionFailures, "extractionFailures");
            return new MigrationReport(this);
        }
    }
}
