package com.webkillerai.kb.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * KB 설정 (kb.yml 매핑 대상). 순수 설정 보관용.
 * 시스템 프로퍼티 오버라이드는 KbConfigLoader 가 처리한다.
 */
public final class KbConfig {

    // ---------- 저장소 ----------
    private Path dbPath = Path.of("out", "kb", "knowledge_base.sqlite");
    private int poolSize = 4;               // Hikari 최대 커넥션 수
    private int busyTimeoutMs = 10_000;     // SQLite busy_timeout

    // ---------- 테이블 이름 ----------
    private String tablePrefix = "knowledge_base_";
    private int tableSuffixLength = 30;     // 세션 간 충돌 방지용 랜덤 접미사 길이
    private String urlSetPrefix = "kb_urls";
    private String requestSetPrefix = "kb_fuzzable_requests";

    // ---------- 동시성 ----------
    private LockPolicy lockPolicy = LockPolicy.COMPOSITE_ONLY;

    // ---------- getters ----------
    public Path getDbPath() { return dbPath; }
    public int getPoolSize() { return poolSize; }
    public int getBusyTimeoutMs() { return busyTimeoutMs; }
    public String getTablePrefix() { return tablePrefix; }
    public int getTableSuffixLength() { return tableSuffixLength; }
    public String getUrlSetPrefix() { return urlSetPrefix; }
    public String getRequestSetPrefix() { return requestSetPrefix; }
    public LockPolicy getLockPolicy() { return lockPolicy == null ? LockPolicy.COMPOSITE_ONLY : lockPolicy; }

    public String getJdbcUrl() { return "jdbc:sqlite:" + dbPath.toAbsolutePath(); }

    // ---------- fluent setters ----------
    public KbConfig setDbPath(Path dbPath) { this.dbPath = dbPath; return this; }
    public KbConfig setPoolSize(int poolSize) { this.poolSize = Math.max(1, poolSize); return this; }
    public KbConfig setBusyTimeoutMs(int ms) { this.busyTimeoutMs = Math.max(0, ms); return this; }
    public KbConfig setTablePrefix(String tablePrefix) { this.tablePrefix = tablePrefix; return this; }
    public KbConfig setTableSuffixLength(int len) { this.tableSuffixLength = len; return this; }
    public KbConfig setUrlSetPrefix(String prefix) { this.urlSetPrefix = prefix; return this; }
    public KbConfig setRequestSetPrefix(String prefix) { this.requestSetPrefix = prefix; return this; }
    public KbConfig setLockPolicy(LockPolicy lockPolicy) {
        this.lockPolicy = (lockPolicy != null ? lockPolicy : LockPolicy.COMPOSITE_ONLY);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(dbPath, "dbPath");
        if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1");
        requireIdentifier(tablePrefix, "tablePrefix");
        requireIdentifier(urlSetPrefix, "urlSetPrefix");
        requireIdentifier(requestSetPrefix, "requestSetPrefix");
        if (tableSuffixLength < 8) throw new IllegalArgumentException("tableSuffixLength must be >= 8");
        if (lockPolicy == null) lockPolicy = LockPolicy.COMPOSITE_ONLY;
    }

    // 테이블 이름은 바인딩이 안 되므로 SQL 에 직접 들어간다
    private static void requireIdentifier(String v, String field) {
        Objects.requireNonNull(v, field);
        if (!v.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException(field + " must be a plain SQL identifier: " + v);
        }
    }

    public static KbConfig defaults() { return new KbConfig(); }
}
