package com.webkillerai.kb.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webkillerai.kb.kb.KnowledgeBase;
import com.webkillerai.kb.model.Info;
import com.webkillerai.kb.model.KbConfig;
import com.webkillerai.kb.model.Severity;
import com.webkillerai.kb.service.KbSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class KbSnapshotExporterTest {

    @TempDir
    Path tmp;

    @Test
    void export_writes_summary_findings_and_dump() throws Exception {
        KbConfig cfg = KbConfig.defaults().setDbPath(tmp.resolve("kb.sqlite"));
        try (KbSession session = KbSession.open(cfg)) {
            KnowledgeBase kb = session.knowledgeBase();
            kb.append("sqli", "sqli", Info.builder().name("SQL injection").severity(Severity.HIGH)
                    .url("http://t/item?id=1").tokenName("id").buildVuln());
            kb.append("headers", "server", Info.builder().name("Server header").url("http://t/").build());
            kb.rawWrite("crawl", "depth", 3);
            kb.addUrl(URI.create("http://t/"));

            Path out = new KbSnapshotExporter().export(tmp, "https://t/scan", kb);

            assertThat(out).exists();
            assertThat(out.getParent()).isEqualTo(tmp.resolve("reports"));
            assertThat(out.getFileName().toString()).matches("kb-t-scan-\\d{8}-\\d{4}\\.json");

            JsonNode root = new ObjectMapper().readTree(Files.readString(out));
            assertThat(root.path("meta").path("label").asText()).isEqualTo("https://t/scan");
            assertThat(root.path("summary").path("vulns").asInt()).isEqualTo(1);
            assertThat(root.path("summary").path("infos").asInt()).isEqualTo(1);
            assertThat(root.path("summary").path("distribution").path("HIGH").asInt()).isEqualTo(1);
            assertThat(root.path("summary").path("knownUrls").asInt()).isEqualTo(1);
            assertThat(root.path("vulns").get(0).path("@kind").asText()).isEqualTo("vuln");
            assertThat(root.path("dump").path("crawl").path("depth").get(0).asInt()).isEqualTo(3);
        }
    }

    @Test
    void slug_is_filesystem_safe() {
        assertThat(SnapshotNaming.slug("HTTPS://Example.com/a b?c=d")).isEqualTo("example.com-a-b-c-d");
        assertThat(SnapshotNaming.slug(null)).isEqualTo("session");
        assertThat(SnapshotNaming.slug("///")).isEqualTo("session");
        assertThat(SnapshotNaming.jsonPath(tmp, "x", Instant.parse("2024-01-02T03:04:00Z")).getFileName().toString())
                .startsWith("kb-x-").endsWith(".json");
    }
}
