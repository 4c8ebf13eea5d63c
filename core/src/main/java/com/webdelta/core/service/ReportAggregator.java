package com.webdelta.core.service;

import com.webdelta.core.model.ComparisonResult;
import com.webdelta.core.model.FieldSchema;
import com.webdelta.core.model.MigrationReport;
import com.webdelta.core.model.Reconciliation;
import com.webdelta.core.model.SeoField;
import com.webdelta.core.model.SiteCrawl;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 페이지별 비교 결과 → MigrationReport 집계. I/O 없음.
 * 변경 없는 비교 결과는 pageComparisons에서 빠진다.
 */
public final class ReportAggregator {

    private final FieldSchema schema;
    private final Clock clock;

    public ReportAggregator(FieldSchema schema) {
        this(schema, Clock.systemUTC());
    }

    public ReportAggregator(FieldSchema schema, Clock clock) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public MigrationReport aggregate(SiteCrawl oldCrawl, SiteCrawl newCrawl,
                                     Reconciliation reconciliation, List<ComparisonResult> comparisons) {
        return aggregate(oldCrawl, newCrawl, reconciliation, comparisons, List.of(), 0L);
    }

    public MigrationReport aggregate(SiteCrawl oldCrawl, SiteCrawl newCrawl,
                                     Reconciliation reconciliation, List<ComparisonResult> comparisons,
                                     List<String> extractionFailures, long durationMs) {
        Objects.requireNonNull(oldCrawl, "oldCrawl");
        Objects.requireNonNull(newCrawl, "newCrawl");
        Objects.requireNonNull(reconciliation, "reconciliation");
        Objects.requireNonNull(comparisons, "comparisons");
        Objects.requireNonNull(extractionFailures, "extractionFailures");

        List<ComparisonResult> changed = new ArrayList<>();
        for (ComparisonResult c : comparisons) {
            if (c != null && c.hasChanges()) changed.add(c);
        }

        Map<SeoField, Integer> impact = new LinkedHashMap<>();
        for (SeoField f : schema.fields()) {
            int n = 0;
            for (ComparisonResult c : changed) if (c.touches(f)) n++;
            impact.put(f, n);
        }

        MigrationReport.Summary summary = new MigrationReport.Summary(
                oldCrawl.getUrls().size(),
                newCrawl.getUrls().size(),
                reconciliation.missing().size(),
                reconciliation.newUrls().size(),
                changed.size(),
                extractionFailures.size());

        MigrationReport.Metadata meta = new MigrationReport.Metadata(
                clock.instant(), oldCrawl.getBaseUrl(), newCrawl.getBaseUrl(), schema, Math.max(0L, durationMs));

        return MigrationReport.builder()
                .metadata(meta)
                .summary(summary)
                .missingUrls(reconciliation.missing())
                .newUrls(reconciliation.newUrls())
                .pageComparisons(changed)
                .fieldImpact(impact)
                .extractionFailures(extractionFailures)
                .build();
    }
}
