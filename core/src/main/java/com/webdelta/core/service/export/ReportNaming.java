package com.webdelta.core.service.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public final class ReportNaming {
    private ReportNaming() {}

    /** 파일명용 타임스탬프: 2024-05-01T09-30-00 (UTC) */
    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss").withZone(ZoneOffset.UTC);

    public static ReportContext context(Path baseDir, Instant startedAt) {
        Path out = (baseDir == null ? Paths.get("out") : baseDir);
        return new ReportContext(out, startedAt == null ? Instant.now() : startedAt);
    }

    public static String timestamp(ReportContext ctx) { return TS_FMT.format(ctx.startedAt()); }
    public static Path snapshotsDir(ReportContext ctx) { return ctx.baseDir().resolve("snapshots"); }
    public static Path resultsDir(ReportContext ctx) { return ctx.baseDir().resolve("results"); }

    public static Path jsonPath(ReportContext ctx) {
        return resultsDir(ctx).resolve("migration_comparison_" + timestamp(ctx) + ".json");
    }
    public static Path markdownPath(ReportContext ctx) {
        return resultsDir(ctx).resolve("migration_report_" + timestamp(ctx) + ".md");
    }
    public static Path oldSnapshotPath(ReportContext ctx) {
        return snapshotsDir(ctx).resolve("old_website_" + timestamp(ctx) + ".json");
    }
    public static Path newSnapshotPath(ReportContext ctx) {
        return snapshotsDir(ctx).resolve("new_website_" + timestamp(ctx) + ".json");
    }

    public record ReportContext(Path baseDir, Instant startedAt) {}
}
