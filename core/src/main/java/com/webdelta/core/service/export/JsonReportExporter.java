package com.webdelta.core.service.export;

import static com.webdelta.core.service.export.ReportNaming.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.webdelta.core.model.ComparisonResult;
import com.webdelta.core.model.FieldChange;
import com.webdelta.core.model.FieldSchema;
import com.webdelta.core.model.MigrationReport;
import com.webdelta.core.model.SeoField;
import com.webdelta.core.util.JsonUtil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

/**
 * 비교 결과 JSON.
 * 최상위 키: testInfo / summary / missingUrls / newUrls / pageComparisons / seoImpact / extractionFailures
 */
public class JsonReportExporter implements ReportExporter {

    private final ObjectMapper mapper;

    public JsonReportExporter() { this(JsonUtil.mapper()); }

    public JsonReportExporter(ObjectMapper mapper) { this.mapper = mapper; }

    @Override
    public Path export(Path baseDir, MigrationReport report) throws IOException {
        var ctx = context(baseDir, report.getMetadata().timestamp());
        Files.createDirectories(resultsDir(ctx));
        Path outFile = jsonPath(ctx);
        Files.writeString(outFile, toJson(report), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return outFile;
    }

    public String toJson(MigrationReport report) throws IOException {
        return mapper.writeValueAsString(toTree(report));
    }

    ObjectNode toTree(MigrationReport report) {
        MigrationReport.Metadata meta = report.getMetadata();
        MigrationReport.Summary s = report.getSummary();
        ObjectNode root = mapper.createObjectNode();

        ObjectNode info = root.putObject("testInfo");
        info.put("timestamp", meta.timestamp().toString());
        info.put("oldDomain", meta.oldDomain());
        info.put("newDomain", meta.newDomain());
        info.put("testType", meta.schema() == FieldSchema.REDUCED ? "quick_comparison" : "full_comparison");
        info.put("fieldSchema", meta.schema().name());
        info.put("testDuration", meta.durationMs() + "ms");

        ObjectNode summary = root.putObject("summary");
        summary.put("oldWebsiteUrls", s.oldWebsiteUrls());
        summary.put("newWebsiteUrls", s.newWebsiteUrls());
        summary.put("missingUrls", s.missingUrls());
        summary.put("newUrls", s.newUrls());
        summary.put("pagesWithChanges", s.pagesWithChanges());
        summary.put("extractionFailures", s.extractionFailures());

        stringArray(root.putArray("missingUrls"), report.getMissingUrls());
        stringArray(root.putArray("newUrls"), report.getNewUrls());

        ArrayNode pages = root.putArray("pageComparisons");
        for (ComparisonResult r : report.getPageComparisons()) {
            ObjectNode p = pages.addObject();
            p.put("url", r.getUrl());
            ArrayNode changes = p.putArray("changes");
            for (FieldChange c : r.getChanges()) {
                ObjectNode cn = changes.addObject();
                cn.put("field", c.getField().key());
                cn.put("old", c.getOldValue());
                cn.put("new", c.getNewValue());
                cn.put("type", c.getChangeType().wireName());
            }
        }

        ObjectNode impact = root.putObject("seoImpact");
        impact.put("pagesWithTitleChanges", report.impactOf(SeoField.TITLE));
        impact.put("pagesWithDescriptionChanges", report.impactOf(SeoField.DESCRIPTION));
        impact.put("pagesWithCanonicalChanges", report.impactOf(SeoField.CANONICAL));
        ObjectNode byField = impact.putObject("byField");
        for (Map.Entry<SeoField, Integer> e : report.getFieldImpact().entrySet()) {
            byField.put(e.getKey().key(), e.getValue());
        }

        stringArray(root.putArray("extractionFailures"), report.getExtractionFailures());
        return root;
    }

    private static void stringArray(ArrayNode arr, List<String> values) {
        for (String v : values) arr.add(v);
    }
}
