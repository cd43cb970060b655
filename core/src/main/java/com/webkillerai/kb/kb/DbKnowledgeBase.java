package com.webkillerai.kb.kb;

import com.webkillerai.kb.db.Column;
import com.webkillerai.kb.db.DbDiskSet;
import com.webkillerai.kb.db.DbException;
import com.webkillerai.kb.db.Dbms;
import com.webkillerai.kb.db.DiskSet;
import com.webkillerai.kb.model.Finding;
import com.webkillerai.kb.model.FuzzableRequest;
import com.webkillerai.kb.model.KbConfig;
import com.webkillerai.kb.model.Severity;
import com.webkillerai.kb.model.SeverityAware;
import com.webkillerai.kb.util.RandomNames;
import com.webkillerai.kb.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Dbms 테이블 하나에 모든 레코드를 저장하는 KnowledgeBase.
 *
 * 테이블: (location_a TEXT, location_b TEXT, uniq_id TEXT, blob BLOB)
 *  - 이름은 prefix + 랜덤 접미사(동시 세션 충돌 방지)
 *  - 같은 주소에 여러 레코드가 쌓일 수 있다(멀티맵). 순서는 rowid(삽입 순서)
 *
 * 생성자는 아무것도 할당하지 않는다. 첫 연산이 setup() 을 한 번만 호출한다.
 */
public class DbKnowledgeBase extends KnowledgeBase {

    private static final Logger LOG = LoggerFactory.getLogger(DbKnowledgeBase.class);
    private static final KbEventLog EVENTS = KbEventLog.get(DbKnowledgeBase.class);

    private static final List<Column> COLUMNS = List.of(
            new Column("location_a", "TEXT"),
            new Column("location_b", "TEXT"),
            new Column("uniq_id", "TEXT"),
            new Column("blob", "BLOB"));

    private final KbConfig cfg;
    private final Supplier<Dbms> dbmsSupplier;
    private final FindingCodec codec;
    private final ObserverRegistry observers = new ObserverRegistry();

    private volatile boolean initialized = false;
    private Dbms db;
    private volatile String tableName;
    // cleanup() 이 교체하므로 락 없이 읽는 스레드도 새 집합을 봐야 한다
    private volatile DbDiskSet<URI> urls;
    private volatile DbDiskSet<FuzzableRequest> fuzzableRequests;

    public DbKnowledgeBase(KbConfig cfg, Supplier<Dbms> dbmsSupplier) {
        this(cfg, dbmsSupplier, new FindingCodec());
    }

    public DbKnowledgeBase(KbConfig cfg, Supplier<Dbms> dbmsSupplier, FindingCodec codec) {
        super(Objects.requireNonNull(cfg, "cfg").getLockPolicy());
        cfg.validate();
        this.cfg = cfg;
        this.dbmsSupplier = Objects.requireNonNull(dbmsSupplier, "dbmsSupplier");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /* =========================
       수명 주기
       ========================= */

    /** 멱등. 동시에 여러 스레드가 들어와도 테이블/집합은 한 번만 만든다 */
    @Override
    public void setup() {
        if (initialized) return;

        kbLock.lock();
        try {
            if (initialized) return;

            if (db == null) {
                db = Objects.requireNonNull(dbmsSupplier.get(), "Dbms supplier returned null");
            }
            String table = RandomNames.tableName(cfg.getTablePrefix(), cfg.getTableSuffixLength());
            DbDiskSet<URI> newUrls = null;
            try {
                db.createTable(table, COLUMNS);
                db.createIndex(table, List.of("location_a", "location_b"));
                db.createIndex(table, List.of("uniq_id"));
                db.commit();

                newUrls = newUrlSet();
                DbDiskSet<FuzzableRequest> newRequests = newRequestSet();

                tableName = table;
                urls = newUrls;
                fuzzableRequests = newRequests;
                initialized = true;
            } catch (RuntimeException e) {
                abandonSetup(table, newUrls, e);
                throw e;
            }

            EVENTS.setup(table, getLockPolicy());
        } finally {
            kbLock.unlock();
        }
    }

    // 실패한 setup 이 만든 테이블은 다음 시도에서 이름이 바뀌므로 여기서 지운다
    private void abandonSetup(String table, DbDiskSet<URI> newUrls, RuntimeException cause) {
        LOG.warn("KB setup failed, dropping partially created table {}", table);
        try {
            if (newUrls != null) newUrls.cleanup();
            db.dropTable(table);
        } catch (RuntimeException dropFailure) {
            cause.addSuppressed(dropFailure);
        }
    }

    @Override
    public boolean isInitialized() { return initialized; }

    private void requireSetup() {
        if (!initialized) setup();
    }

    /** 레코드/커버리지 집합/옵저버를 비운다. 테이블은 남고 계속 사용할 수 있다 */
    @Override
    public void cleanup() {
        requireSetup();
        kbLock.lock();
        try {
            int rows = db.execute("DELETE FROM " + tableName + " WHERE 1=1");

            urls.cleanup();
            urls = newUrlSet();

            fuzzableRequests.cleanup();
            fuzzableRequests = newRequestSet();

            observers.clear();
            EVENTS.cleanup(tableName, rows);
        } finally {
            kbLock.unlock();
        }
    }

    /** 테이블과 커버리지 집합을 삭제한다. 이후 연산은 새 테이블로 다시 setup 된다 */
    @Override
    public void remove() {
        requireSetup();
        kbLock.lock();
        try {
            db.dropTable(tableName);
            urls.cleanup();
            fuzzableRequests.cleanup();
            observers.clear();
            initialized = false;
            EVENTS.remove(tableName);
        } finally {
            kbLock.unlock();
        }
    }

    /* =========================
       쓰기
       ========================= */

    @Override
    public void append(String locationA, String locationB, Finding value) {
        if (value == null) throw new IllegalArgumentException("append requires a Finding; use rawWrite for other values");
        requireSetup();
        guarded(() -> appendRecord(locationA, locationB, value, false));
    }

    private void appendRecord(String locationA, String locationB, Object value, boolean raw) {
        requireAddress(locationA, locationB);
        insertRecord(locationA, locationB, value, codec.encode(value), raw);
    }

    private void insertRecord(String locationA, String locationB, Object value, byte[] blob, boolean raw) {
        db.execute("INSERT INTO " + tableName + " (location_a, location_b, uniq_id, blob) VALUES (?, ?, ?, ?)",
                locationA, locationB, FindingCodec.uniqIdOf(value), blob);
        observers.fire(o -> o.onAppend(locationA, locationB, value, raw));
    }

    /** 주소의 기존 레코드를 지우고 value 하나만 남긴다 */
    @Override
    public void rawWrite(String locationA, String locationB, Object value) {
        requireNonNullArg(value, "value");
        if (value instanceof Finding) {
            throw new IllegalArgumentException(
                    "Use append() or appendUniq() to store Finding instances, rawWrite() got " + value.getClass().getSimpleName());
        }
        requireSetup();
        guarded(() -> {
            requireAddress(locationA, locationB);
            // 직렬화 실패 시 기존 값을 지우지 않도록 먼저 인코딩한다
            byte[] blob = codec.encode(value);
            db.execute("DELETE FROM " + tableName + " WHERE location_a = ? AND location_b = ?", locationA, locationB);
            insertRecord(locationA, locationB, value, blob, true);
        });
    }

    /**
     * oldValue 의 식별자로 레코드를 찾아 newValue 로 교체한다.
     * 일치하는 레코드가 없으면 아무것도 바꾸지 않고 DbException.
     */
    @Override
    public void update(Finding oldValue, Finding newValue) {
        if (oldValue == null || newValue == null) {
            throw new IllegalArgumentException("update requires two Finding instances");
        }
        requireSetup();
        guarded(() -> {
            String oldId = oldValue.getUniqId();
            String newId = newValue.getUniqId();
            int rows = db.execute("UPDATE " + tableName + " SET blob = ?, uniq_id = ? WHERE uniq_id = ?",
                    codec.encode(newValue), newId, oldId);
            if (rows == 0) {
                EVENTS.updateStale(tableName, oldId, newId);
                throw new DbException(String.format(
                        "Failed to update() %s instance because the original unique_id (%s) does not exist in the DB,"
                                + " or the new unique_id (%s) is invalid.",
                        oldValue.getClass().getSimpleName(), oldId, newId));
            }
            observers.fire(o -> o.onUpdate(oldValue, newValue));
        });
    }

    @Override
    public void clear(String locationA, String locationB) {
        requireSetup();
        guarded(() -> {
            int rows = db.execute("DELETE FROM " + tableName + " WHERE location_a = ? AND location_b = ?",
                    locationA, locationB);
            LOG.debug("clear({}, {}) removed {} records", locationA, locationB, rows);
        });
    }

    /* =========================
       읽기
       ========================= */

    @Override
    public List<Finding> get(String locationA, String locationB) {
        List<Object> values = get(locationA, locationB, true);
        List<Finding> out = new ArrayList<>(values.size());
        for (Object v : values) out.add((Finding) v);
        return out;
    }

    @Override
    public List<Object> get(String locationA, String locationB, boolean checkTypes) {
        requireSetup();
        return guarded(() -> {
            List<Map<String, Object>> rows = (locationB == null)
                    ? db.select("SELECT blob FROM " + tableName + " WHERE location_a = ? ORDER BY rowid", locationA)
                    : db.select("SELECT blob FROM " + tableName + " WHERE location_a = ? AND location_b = ? ORDER BY rowid",
                            locationA, locationB);

            List<Object> out = new ArrayList<>(rows.size());
            for (Map<String, Object> r : rows) {
                Object v = decode(r);
                if (checkTypes && !(v instanceof Finding)) {
                    throw new IllegalArgumentException(String.format(
                            "get() found a non-Finding value at (%s, %s); use rawRead() for raw data",
                            locationA, locationB));
                }
                out.add(v);
            }
            return out;
        });
    }

    /** 주소의 단일 값. 없으면 empty, 둘 이상이면 IllegalStateException */
    @Override
    public Optional<Object> rawRead(String locationA, String locationB) {
        return single("rawRead", locationA, locationB, get(locationA, locationB, false));
    }

    @Override
    public <T> Optional<T> rawRead(String locationA, String locationB, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return rawRead(locationA, locationB).map(v -> codec.convert(v, type));
    }

    @Override
    public Optional<Finding> getOne(String locationA, String locationB) {
        return single("getOne", locationA, locationB, get(locationA, locationB));
    }

    private static <T> Optional<T> single(String op, String locationA, String locationB, List<T> values) {
        if (values.size() > 1) {
            throw new IllegalStateException(String.format(
                    "%s(%s, %s) expects at most one stored value, found %d", op, locationA, locationB, values.size()));
        }
        return values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    @Override
    public Optional<Object> getByUniqId(String uniqId) {
        requireSetup();
        return guarded(() -> db.selectOne("SELECT blob FROM " + tableName + " WHERE uniq_id = ? ORDER BY rowid LIMIT 1", uniqId)
                .map(this::decode));
    }

    @Override
    public <T> List<T> getAllEntriesOfClass(Class<T> kind) {
        Objects.requireNonNull(kind, "kind");
        List<T> out = new ArrayList<>();
        for (Object v : scanAll(kind::isInstance)) out.add(kind.cast(v));
        return out;
    }

    @Override
    public List<Finding> getAllVulns() {
        return severityScan(s -> s.isVulnLevel());
    }

    @Override
    public List<Finding> getAllInfos() {
        return severityScan(s -> s == Severity.INFORMATION);
    }

    // 심각도 개념이 없는 레코드(Shell, raw 값)는 양쪽 모두에서 빠진다
    private List<Finding> severityScan(Predicate<Severity> level) {
        List<Finding> out = new ArrayList<>();
        for (Object v : scanAll(v -> v instanceof SeverityAware sa && sa.getSeverity() != null && level.test(sa.getSeverity()))) {
            out.add((Finding) v);
        }
        return out;
    }

    /** locationA → locationB → 삽입 순서의 값 목록 */
    @Override
    public Map<String, Map<String, List<Object>>> dump() {
        requireSetup();
        return guarded(() -> {
            Map<String, Map<String, List<Object>>> out = new LinkedHashMap<>();
            for (Map<String, Object> r : db.select("SELECT location_a, location_b, blob FROM " + tableName + " ORDER BY rowid")) {
                String a = (String) r.get("location_a");
                String b = (String) r.get("location_b");
                out.computeIfAbsent(a, k -> new LinkedHashMap<>())
                        .computeIfAbsent(b, k -> new ArrayList<>())
                        .add(decode(r));
            }
            return out;
        });
    }

    private List<Object> scanAll(Predicate<Object> keep) {
        requireSetup();
        return guarded(() -> {
            List<Object> out = new ArrayList<>();
            for (Map<String, Object> r : db.select("SELECT blob FROM " + tableName + " ORDER BY rowid")) {
                Object v = decode(r);
                if (keep.test(v)) out.add(v);
            }
            return out;
        });
    }

    private Object decode(Map<String, Object> row) {
        return codec.decode((byte[]) row.get("blob"));
    }

    /* =========================
       옵저버
       ========================= */

    @Override
    public int addObserver(KbObserver observer) {
        requireNonNullArg(observer, "observer");
        return observers.add(observer);
    }

    @Override
    public boolean removeObserver(int handle) {
        return observers.remove(handle);
    }

    /* =========================
       커버리지 집합
       ========================= */

    /** @return 처음 본 URL 이면 true. onAddUrl 은 매 호출마다 통지된다 */
    @Override
    public boolean addUrl(URI url) {
        if (url == null) throw new IllegalArgumentException("addUrl requires a URL");
        requireSetup();
        return guarded(() -> {
            observers.fire(o -> o.onAddUrl(url));
            return urls.add(url);
        });
    }

    /** URL 등록 후 요청 모양을 등록한다(두 단계는 하나의 트랜잭션이 아니다) */
    @Override
    public boolean addFuzzableRequest(FuzzableRequest request) {
        if (request == null) throw new IllegalArgumentException("addFuzzableRequest requires a FuzzableRequest");
        addUrl(request.url());
        return guarded(() -> fuzzableRequests.add(request));
    }

    @Override
    public DiskSet<URI> getAllKnownUrls() {
        requireSetup();
        return urls;
    }

    @Override
    public DiskSet<FuzzableRequest> getAllKnownFuzzableRequests() {
        requireSetup();
        return fuzzableRequests;
    }

    /* =========================
       내부
       ========================= */

    public String getTableName() {
        requireSetup();
        return tableName;
    }

    public FindingCodec getCodec() { return codec; }

    public KbConfig getConfig() { return cfg; }

    private DbDiskSet<URI> newUrlSet() {
        return new DbDiskSet<>(db, cfg.getUrlSetPrefix(), URI.class, UrlUtils::urlKey, codec.mapper());
    }

    private DbDiskSet<FuzzableRequest> newRequestSet() {
        return new DbDiskSet<>(db, cfg.getRequestSetPrefix(), FuzzableRequest.class, UrlUtils::requestShapeKey, codec.mapper());
    }

    private static void requireAddress(String locationA, String locationB) {
        if (locationA == null) throw new IllegalArgumentException("locationA must not be null");
        if (locationB == null) throw new IllegalArgumentException("locationB must not be null for writes");
    }
}
