package com.webdelta.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.webdelta.core.model.PageSnapshot;
import com.webdelta.core.model.SiteCrawl;
import com.webdelta.core.util.JsonUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotExporterTest {

    @Test
    @DisplayName("urls 목록 + 정리된 키별 HTML")
    void snapshotShape() throws Exception {
        SiteCrawl c = new SiteCrawl("https://ex.com",
                List.of("https://ex.com/a?x=1", "https://ex.com/b"),
                List.of(new PageSnapshot("https://ex.com", "<p>root</p>"),
                        new PageSnapshot("https://ex.com/a?x=1", "<p>a</p>")),
                List.of("https://ex.com/b"));

        JsonNode root = JsonUtil.mapper().readTree(new SnapshotExporter().toJson(c));

        assertThat(root.get("urls")).hasSize(2);
        assertThat(root.get("snapshots").get("https___ex_com").asText()).isEqualTo("<p>root</p>");
        assertThat(root.get("snapshots").get("https___ex_com_a_x_1").asText()).isEqualTo("<p>a</p>");
        assertThat(root.get("snapshots").size()).isEqualTo(2);
    }

    @Test
    @DisplayName("치환 후 키가 겹치면(/a-b, /a_b) 나중 페이지가 남는다")
    void keyCollisionKeepsLater() throws Exception {
        SiteCrawl c = new SiteCrawl("https://ex.com",
                List.of("https://ex.com/a-b", "https://ex.com/a_b"),
                List.of(new PageSnapshot("https://ex.com/a-b", "<p>dash</p>"),
                        new PageSnapshot("https://ex.com/a_b", "<p>underscore</p>")),
                List.of());

        JsonNode root = JsonUtil.mapper().readTree(new SnapshotExporter().toJson(c));

        assertThat(root.get("urls")).hasSize(2);
        assertThat(root.get("snapshots").size()).isEqualTo(1);
        assertThat(root.get("snapshots").get("https___ex_com_a_b").asText()).isEqualTo("<p>underscore</p>");
    }
}
