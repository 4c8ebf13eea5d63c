package com.webdelta.core.service;

import com.webdelta.core.model.MigrationReport;
import com.webdelta.core.model.SiteCrawl;

import java.util.Objects;

/** 비교 1회 산출물: 두 사이트 크롤 결과 + 보고서 */
public record CompareOutcome(SiteCrawl oldCrawl, SiteCrawl newCrawl, MigrationReport report) {
    public CompareOutcome {
        Objects.requireNonNull(oldCrawl, "oldCrawl");
        Objects.requireNonNull(newCrawl, "newCrawl");
        Objects.requireNonNull(report, "report");
    }
}
