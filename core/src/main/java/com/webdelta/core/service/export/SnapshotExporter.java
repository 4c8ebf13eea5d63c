package com.webdelta.core.service.export;

import static com.webdelta.core.service.export.ReportNaming.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.webdelta.core.model.SiteCrawl;
import com.webdelta.core.util.JsonUtil;
import com.webdelta.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 크롤 원본 보존: {urls: [...], snapshots: {sanitizedKey: html}}.
 * 키는 URL의 영숫자 외 문자를 '_'로 치환한 값. 서로 다른 URL이 같은 키가 되면 경고 후 나중 값 유지.
 */
public class SnapshotExporter {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotExporter.class);

    private final ObjectMapper mapper;

    public SnapshotExporter() { this(JsonUtil.mapper()); }

    public SnapshotExporter(ObjectMapper mapper) { this.mapper = mapper; }

    /** @return [old, new] 순서의 파일 경로 */
    public List<Path> export(Path baseDir, Instant startedAt, SiteCrawl oldCrawl, SiteCrawl newCrawl) throws IOException {
        var ctx = context(baseDir, startedAt);
        Files.createDirectories(snapshotsDir(ctx));
        Path oldFile = oldSnapshotPath(ctx);
        Path newFile = newSnapshotPath(ctx);
        write(oldFile, oldCrawl);
        write(newFile, newCrawl);
        return List.of(oldFile, newFile);
    }

    public String toJson(SiteCrawl crawl) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        var urls = root.putArray("urls");
        for (String u : crawl.getUrls()) urls.add(u);
        ObjectNode snaps = root.putObject("snapshots");
        for (Map.Entry<String, String> e : crawl.getSnapshots().entrySet()) {
            String key = UrlUtils.sanitizeKey(e.getKey());
            if (snaps.has(key)) {
                // 치환 충돌: 나중 페이지가 앞의 것을 덮어쓴다
                LOG.warn("Snapshot key collision on '{}': {} overwrites an earlier page", key, e.getKey());
            }
            snaps.put(key, e.getValue());
        }
        return mapper.writeValueAsString(root);
    }

    private void write(Path file, SiteCrawl crawl) throws IOException {
        Files.writeString(file, toJson(crawl), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
    }
}
