package com.webkillerai.kb.service.export;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** KB 스냅샷 파일 경로 규칙: <outDir>/reports/kb-<slug>-<yyyyMMdd-HHmm>.json */
public final class SnapshotNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    private SnapshotNaming() {}

    public static Path reportsDir(Path baseDir) {
        return (baseDir == null ? Paths.get("out") : baseDir).resolve("reports");
    }

    public static Path jsonPath(Path baseDir, String label, Instant at) {
        return reportsDir(baseDir).resolve("kb-" + slug(label) + "-" + TS_FMT.format(at) + ".json");
    }

    static String slug(String label) {
        if (label == null || label.isBlank()) return "session";
        String s = label.toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._-]", "-").replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "session" : s;
    }
}
