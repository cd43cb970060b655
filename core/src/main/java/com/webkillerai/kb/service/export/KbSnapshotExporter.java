package com.webkillerai.kb.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.webkillerai.kb.kb.KnowledgeBase;
import com.webkillerai.kb.model.Finding;
import com.webkillerai.kb.model.Severity;
import com.webkillerai.kb.model.SeverityAware;
import com.webkillerai.kb.util.JsonMappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * KB 스냅샷 JSON.
 * 구조: meta / summary(심각도별 개수, 커버리지 수) / vulns / infos / dump
 */
public class KbSnapshotExporter {

    public static final String SNAPSHOT_VERSION = "1.0";

    private final ObjectMapper om;

    public KbSnapshotExporter() {
        this(JsonMappers.standard());
    }

    public KbSnapshotExporter(ObjectMapper om) {
        this.om = om.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** @return 생성된 파일 경로 */
    public Path export(Path baseDir, String label, KnowledgeBase kb) throws IOException {
        Instant now = Instant.now();
        Path outFile = SnapshotNaming.jsonPath(baseDir, label, now);
        Files.createDirectories(outFile.getParent());
        om.writeValue(outFile.toFile(), buildSnapshot(label, kb, now));
        return outFile;
    }

    Map<String, Object> buildSnapshot(String label, KnowledgeBase kb, Instant generatedAt) {
        List<Finding> vulns = kb.getAllVulns();
        List<Finding> infos = kb.getAllInfos();

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("snapshotVersion", SNAPSHOT_VERSION);
        meta.put("generatedAt", generatedAt.toString());
        meta.put("label", label);

        Map<Severity, Integer> distribution = new EnumMap<>(Severity.class);
        for (Severity s : Severity.values()) distribution.put(s, 0);
        for (Finding f : vulns) distribution.merge(((SeverityAware) f).getSeverity(), 1, Integer::sum);
        distribution.put(Severity.INFORMATION, infos.size());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("vulns", vulns.size());
        summary.put("infos", infos.size());
        summary.put("findings", kb.getAllFindings().size());
        summary.put("shells", kb.getAllShells().size());
        summary.put("distribution", distribution);
        summary.put("knownUrls", kb.getAllKnownUrls().size());
        summary.put("knownFuzzableRequests", kb.getAllKnownFuzzableRequests().size());

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("meta", meta);
        root.put("summary", summary);
        root.put("vulns", toNodes(vulns));
        root.put("infos", toNodes(infos));
        root.put("dump", dumpNodes(kb.dump()));
        return root;
    }

    // 값 하나씩 루트로 변환해야 "@kind" 가 빠지지 않는다
    private List<JsonNode> toNodes(List<?> values) {
        List<JsonNode> out = new ArrayList<>(values.size());
        for (Object v : values) out.add(om.valueToTree(v));
        return out;
    }

    private Map<String, Map<String, List<JsonNode>>> dumpNodes(Map<String, Map<String, List<Object>>> dump) {
        Map<String, Map<String, List<JsonNode>>> out = new LinkedHashMap<>();
        dump.forEach((a, byB) -> {
            Map<String, List<JsonNode>> inner = new LinkedHashMap<>();
            byB.forEach((b, values) -> inner.put(b, toNodes(values)));
            out.put(a, inner);
        });
        return out;
    }
}
