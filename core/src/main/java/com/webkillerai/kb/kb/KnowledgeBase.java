package com.webkillerai.kb.kb;

import com.webkillerai.kb.db.DiskSet;
import com.webkillerai.kb.model.FuzzableRequest;
import com.webkillerai.kb.model.Finding;
import com.webkillerai.kb.model.Info;
import com.webkillerai.kb.model.InfoSet;
import com.webkillerai.kb.model.LockPolicy;
import com.webkillerai.kb.model.Named;
import com.webkillerai.kb.model.Shell;
import com.webkillerai.kb.model.ShellRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 플러그인들이 결과를 주고받는 유일한 통로.
 *
 * 주소는 (locationA, locationB) 두 단계이고 한 주소에 여러 레코드가 쌓인다.
 * locationA 는 보통 플러그인 이름이며 Named 를 넘기면 getName() 으로 정규화된다.
 *
 * 락 규칙:
 *  - appendUniq / appendUniqGroup / setup 은 항상 kbLock 을 잡는다(확인 후 쓰기 원자성)
 *  - 나머지 기본 연산은 LockPolicy.ALL_OPERATIONS 일 때만 같은 락을 잡는다
 *
 * 이 클래스는 중복 제거/그룹화 알고리즘을 담고, 저장은 하위 클래스가 담당한다.
 */
public abstract class KnowledgeBase {

    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeBase.class);
    private static final KbEventLog EVENTS = KbEventLog.get(KnowledgeBase.class);

    protected final ReentrantLock kbLock = new ReentrantLock();
    private final LockPolicy lockPolicy;

    protected KnowledgeBase(LockPolicy lockPolicy) {
        this.lockPolicy = (lockPolicy == null ? LockPolicy.COMPOSITE_ONLY : lockPolicy);
    }

    public LockPolicy getLockPolicy() { return lockPolicy; }

    /* =========================
       복합 연산 (항상 락)
       ========================= */

    /**
     * (locationA, locationB) 에 filter 기준으로 같은 결과가 없을 때만 저장한다.
     *
     * @return 저장했으면 true, 이미 같은 결과가 있었으면 false
     */
    public boolean appendUniq(String locationA, String locationB, Info info, FilterKind filter) {
        if (info == null) throw new IllegalArgumentException("appendUniq requires an Info instance");
        if (filter == null) throw new IllegalArgumentException("appendUniq only knows about URL or VAR filters");

        kbLock.lock();
        try {
            for (Finding saved : get(locationA, locationB)) {
                if (filter.matches(saved, info)) {
                    LOG.debug("appendUniq skipped duplicate {} at ({}, {}) by {}", info, locationA, locationB, filter);
                    return false;
                }
            }
            append(locationA, locationB, info);
            return true;
        } finally {
            kbLock.unlock();
        }
    }

    /** 필터 이름("URL"/"VAR") 버전. 모르는 이름이면 IllegalArgumentException */
    public boolean appendUniq(String locationA, String locationB, Info info, String filterBy) {
        return appendUniq(locationA, locationB, info, FilterKind.of(filterBy));
    }

    /** 기본 필터는 VAR */
    public boolean appendUniq(String locationA, String locationB, Info info) {
        return appendUniq(locationA, locationB, info, FilterKind.VAR);
    }

    public boolean appendUniq(Named locationA, String locationB, Info info, FilterKind filter) {
        return appendUniq(nameOf(locationA), locationB, info, filter);
    }

    public boolean appendUniq(Named locationA, String locationB, Info info, String filterBy) {
        return appendUniq(nameOf(locationA), locationB, info, filterBy);
    }

    public boolean appendUniq(Named locationA, String locationB, Info info) {
        return appendUniq(nameOf(locationA), locationB, info);
    }

    /**
     * info 를 주소에 있는 InfoSet 중 match() 하는 첫 그룹에 합친다.
     * 없으면 factory 로 [info] 를 담은 새 InfoSet 을 만들어 저장한다.
     *
     * 합칠 때는 저장본을 직접 고치지 않고 복사본에 add() 한 뒤
     * 이전 식별자 기준으로 update(before, merged) 한다.
     */
    public GroupResult appendUniqGroup(String locationA, String locationB, Info info, InfoSetFactory factory) {
        if (info == null) throw new IllegalArgumentException("appendUniqGroup requires an Info instance");
        if (factory == null) throw new IllegalArgumentException("appendUniqGroup requires an InfoSet factory");

        kbLock.lock();
        try {
            for (Finding saved : get(locationA, locationB)) {
                if (!(saved instanceof InfoSet before)) continue;

                if (before.match(info)) {
                    InfoSet merged = before.copy();
                    merged.add(info);
                    update(before, merged);
                    EVENTS.groupMerged(locationA, locationB, merged);
                    return new GroupResult(merged, false);
                }
            }

            InfoSet created = factory.create(List.of(info));
            if (created == null) throw new IllegalArgumentException("InfoSet factory returned null");
            append(locationA, locationB, created);
            EVENTS.groupCreated(locationA, locationB, created);
            return new GroupResult(created, true);
        } finally {
            kbLock.unlock();
        }
    }

    public GroupResult appendUniqGroup(String locationA, String locationB, Info info) {
        return appendUniqGroup(locationA, locationB, info, InfoSetFactory.DEFAULT);
    }

    public GroupResult appendUniqGroup(Named locationA, String locationB, Info info, InfoSetFactory factory) {
        return appendUniqGroup(nameOf(locationA), locationB, info, factory);
    }

    public GroupResult appendUniqGroup(Named locationA, String locationB, Info info) {
        return appendUniqGroup(nameOf(locationA), locationB, info);
    }

    /* =========================
       리포팅 조회
       ========================= */

    /** Info, Vuln, InfoSet 전부(Shell 제외) */
    public List<Finding> getAllFindings() {
        List<Finding> out = new ArrayList<>();
        for (Object o : getAllEntriesOfClass(Finding.class)) {
            if (o instanceof Info || o instanceof InfoSet) out.add((Finding) o);
        }
        return out;
    }

    /** runtime 이 주어지면 HTTP 클라이언트/워커 풀을 다시 붙여서 돌려준다 */
    public List<Shell> getAllShells(ShellRuntime runtime) {
        List<Shell> shells = getAllEntriesOfClass(Shell.class);
        if (runtime != null) {
            for (Shell s : shells) s.attach(runtime.urlOpener(), runtime.workerPool());
        }
        return shells;
    }

    public List<Shell> getAllShells() { return getAllShells(null); }

    /* =========================
       Named 편의 오버로드
       ========================= */

    public void append(Named locationA, String locationB, Finding value) {
        append(nameOf(locationA), locationB, value);
    }

    public List<Finding> get(Named locationA, String locationB) {
        return get(nameOf(locationA), locationB);
    }

    public List<Object> get(Named locationA, String locationB, boolean checkTypes) {
        return get(nameOf(locationA), locationB, checkTypes);
    }

    public void rawWrite(Named locationA, String locationB, Object value) {
        rawWrite(nameOf(locationA), locationB, value);
    }

    public Optional<Object> rawRead(Named locationA, String locationB) {
        return rawRead(nameOf(locationA), locationB);
    }

    public <T> Optional<T> rawRead(Named locationA, String locationB, Class<T> type) {
        return rawRead(nameOf(locationA), locationB, type);
    }

    public Optional<Finding> getOne(Named locationA, String locationB) {
        return getOne(nameOf(locationA), locationB);
    }

    public void clear(Named locationA, String locationB) {
        clear(nameOf(locationA), locationB);
    }

    protected static String nameOf(Named named) {
        if (named == null) throw new IllegalArgumentException("locationA must not be null");
        String name = named.getName();
        if (name == null) throw new IllegalArgumentException("Named locationA returned a null name");
        return name;
    }

    /** LockPolicy.ALL_OPERATIONS 일 때만 락 */
    protected <T> T guarded(Supplier<T> op) {
        if (lockPolicy != LockPolicy.ALL_OPERATIONS) return op.get();
        kbLock.lock();
        try {
            return op.get();
        } finally {
            kbLock.unlock();
        }
    }

    protected void guarded(Runnable op) {
        guarded(() -> {
            op.run();
            return null;
        });
    }

    protected static void requireNonNullArg(Object v, String name) {
        if (v == null) throw new IllegalArgumentException(name + " must not be null");
    }

    /* =========================
       저장소 연산 (하위 클래스)
       ========================= */

    public abstract void setup();

    public abstract boolean isInitialized();

    public abstract void append(String locationA, String locationB, Finding value);

    /** 주소의 Finding 전부. locationB 가 null 이면 locationA 아래 전부. 비-Finding 이 있으면 실패 */
    public abstract List<Finding> get(String locationA, String locationB);

    public List<Finding> get(String locationA) { return get(locationA, null); }

    /** checkTypes=false 면 raw 값도 그대로 돌려준다 */
    public abstract List<Object> get(String locationA, String locationB, boolean checkTypes);

    public abstract void update(Finding oldValue, Finding newValue);

    public abstract void rawWrite(String locationA, String locationB, Object value);

    public abstract Optional<Object> rawRead(String locationA, String locationB);

    public abstract <T> Optional<T> rawRead(String locationA, String locationB, Class<T> type);

    public abstract Optional<Finding> getOne(String locationA, String locationB);

    public abstract void clear(String locationA, String locationB);

    public abstract <T> List<T> getAllEntriesOfClass(Class<T> kind);

    public abstract List<Finding> getAllVulns();

    public abstract List<Finding> getAllInfos();

    public abstract Map<String, Map<String, List<Object>>> dump();

    public abstract Optional<Object> getByUniqId(String uniqId);

    public abstract int addObserver(KbObserver observer);

    public abstract boolean removeObserver(int handle);

    public abstract boolean addUrl(URI url);

    public abstract boolean addFuzzableRequest(FuzzableRequest request);

    public abstract DiskSet<URI> getAllKnownUrls();

    public abstract DiskSet<FuzzableRequest> getAllKnownFuzzableRequests();

    public abstract void cleanup();

    public abstract void remove();
}
