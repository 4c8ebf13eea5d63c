package com.webdelta.core.service.export;

import com.webdelta.core.model.MigrationReport;
import com.webdelta.core.service.CompareOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import static com.webdelta.core.service.export.ReportNaming.*;

public final class ExportCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ExportCoordinator.class);

    private final JsonReportExporter json = new JsonReportExporter();
    private final MarkdownReportExporter markdown = new MarkdownReportExporter();
    private final SnapshotExporter snapshots = new SnapshotExporter();

    /**
     * formats: 소문자 {"json","md","snapshots"}. 비어 있으면 JSON만.
     * 쓰기 실패(IOException)는 그대로 전파한다.
     *
     * @return 생성된 파일 목록(생성 순서)
     */
    public List<Path> exportAll(Path baseDir, CompareOutcome outcome, Collection<String> formats) throws IOException {
        Objects.requireNonNull(outcome, "outcome");
        MigrationReport report = outcome.report();
        var ctx = context(baseDir, report.getMetadata().timestamp());
        Files.createDirectories(ctx.baseDir());

        boolean wantJson = formats == null || formats.isEmpty() || formats.contains("json");
        boolean wantMd = formats != null && formats.contains("md");
        boolean wantSnapshots = formats != null && formats.contains("snapshots");

        LOG.info("[Export plan] dir={}, json={}, md={}, snapshots={}",
                ctx.baseDir().toAbsolutePath(), wantJson, wantMd, wantSnapshots);

        List<Path> written = new ArrayList<>();
        if (wantSnapshots) {
            written.addAll(snapshots.export(ctx.baseDir(), ctx.startedAt(), outcome.oldCrawl(), outcome.newCrawl()));
        }
        if (wantJson) {
            written.add(json.export(ctx.baseDir(), report));
        }
        if (wantMd) {
            written.add(markdown.export(ctx.baseDir(), report));
        }
        for (Path p : written) LOG.info("Saved: {}", p.toAbsolutePath());
        return written;
    }
}
