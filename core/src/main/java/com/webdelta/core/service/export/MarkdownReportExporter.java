package com.webdelta.core.service.export;

import static com.webdelta.core.service.export.ReportNaming.*;

import com.webdelta.core.model.ComparisonResult;
import com.webdelta.core.model.FieldChange;
import com.webdelta.core.model.MigrationReport;
import com.webdelta.core.model.SeoField;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** 사람이 읽는 Markdown 보고서 */
public class MarkdownReportExporter implements ReportExporter {

    static final String EMPTY = "(empty)";

    @Override
    public Path export(Path baseDir, MigrationReport report) throws IOException {
        var ctx = context(baseDir, report.getMetadata().timestamp());
        Files.createDirectories(resultsDir(ctx));
        Path outFile = markdownPath(ctx);
        Files.writeString(outFile, render(report, Instant.now()), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return outFile;
    }

    public String render(MigrationReport report, Instant generatedAt) {
        MigrationReport.Metadata meta = report.getMetadata();
        MigrationReport.Summary s = report.getSummary();
        StringBuilder sb = new StringBuilder(4096);

        sb.append("# Website Migration Comparison Report\n\n");

        sb.append("## Test Information\n\n")
          .append("- **Timestamp:** ").append(meta.timestamp()).append('\n')
          .append("- **Old Domain:** ").append(meta.oldDomain()).append('\n')
          .append("- **New Domain:** ").append(meta.newDomain()).append('\n')
          .append("- **Field Schema:** ").append(meta.schema().name())
              .append(" (").append(meta.schema().size()).append(" fields)\n")
          .append("- **Duration:** ").append(meta.durationMs()).append("ms\n\n");

        sb.append("## Summary\n\n")
          .append("| Metric | Count |\n")
          .append("|--------|-------|\n")
          .append(row("Old Website URLs", s.oldWebsiteUrls()))
          .append(row("New Website URLs", s.newWebsiteUrls()))
          .append(row("Missing URLs", s.missingUrls()))
          .append(row("New URLs", s.newUrls()))
          .append(row("Pages with Changes", s.pagesWithChanges()))
          .append(row("Extraction Failures", s.extractionFailures()))
          .append('\n');

        sb.append("## SEO Impact Analysis\n\n")
          .append("| Change Type | Affected Pages |\n")
          .append("|-------------|----------------|\n");
        for (Map.Entry<SeoField, Integer> e : report.getFieldImpact().entrySet()) {
            sb.append(row(e.getKey().label() + " Changes", e.getValue()));
        }
        sb.append('\n');

        urlSection(sb, "Missing URLs", report.getMissingUrls(), "*No missing URLs found*");
        urlSection(sb, "New URLs", report.getNewUrls(), "*No new URLs found*");

        List<ComparisonResult> pages = report.getPageComparisons();
        sb.append("## Pages with Changes (").append(pages.size()).append(")\n\n");
        if (pages.isEmpty()) {
            sb.append("*No pages with changes found*\n\n");
        } else {
            int pi = 1;
            for (ComparisonResult r : pages) {
                sb.append("### ").append(pi++).append(". ").append(r.getUrl()).append("\n\n");
                int ci = 1;
                for (FieldChange c : r.getChanges()) {
                    sb.append("#### ").append(ci++).append(". ").append(c.getField().key()).append("\n\n")
                      .append("**Old Value:** ").append(orEmpty(c.getOldValue())).append("  \n")
                      .append("**New Value:** ").append(orEmpty(c.getNewValue())).append("\n\n");
                }
            }
        }

        if (!report.getExtractionFailures().isEmpty()) {
            urlSection(sb, "Extraction Failures", report.getExtractionFailures(), "");
        }

        sb.append("---\n\n")
          .append("*Report generated on ").append(generatedAt).append("*\n");
        return sb.toString();
    }

    private static String row(String label, int count) {
        return "| " + label + " | " + count + " |\n";
    }

    private static void urlSection(StringBuilder sb, String title, List<String> urls, String none) {
        sb.append("## ").append(title).append(" (").append(urls.size()).append(")\n\n");
        if (urls.isEmpty()) {
            sb.append(none).append("\n\n");
            return;
        }
        int i = 1;
        for (String u : urls) sb.append(i++).append(". `").append(u).append("`\n");
        sb.append('\n');
    }

    static String orEmpty(String v) {
        return (v == null || v.isEmpty()) ? EMPTY : v;
    }
}
