package com.webkillerai.kb.service;

import com.webkillerai.kb.db.DataSources;
import com.webkillerai.kb.db.Dbms;
import com.webkillerai.kb.db.JdbiDbms;
import com.webkillerai.kb.kb.DbKnowledgeBase;
import com.webkillerai.kb.kb.KnowledgeBase;
import com.webkillerai.kb.model.KbConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 스캔 한 번 동안의 KB 소유자.
 * 플러그인에는 knowledgeBase() 만 넘긴다(전역 싱글톤 없음).
 *
 * 커넥션 풀은 KB 가 처음 setup 될 때 연다. 생성만 하고 쓰지 않으면 아무 자원도 잡지 않는다.
 */
public final class KbSession implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KbSession.class);

    private final KbConfig cfg;
    private final DbKnowledgeBase kb;
    private final Object poolLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private HikariDataSource dataSource;

    public KbSession(KbConfig cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.kb = new DbKnowledgeBase(cfg, this::openDbms);
    }

    public static KbSession open(KbConfig cfg) {
        return new KbSession(cfg);
    }

    public KnowledgeBase knowledgeBase() {
        ensureOpen();
        return kb;
    }

    /** 같은 세션을 다음 스캔에 재사용 */
    public void reset() {
        ensureOpen();
        kb.cleanup();
    }

    public boolean isPoolOpen() {
        synchronized (poolLock) {
            return dataSource != null && !dataSource.isClosed();
        }
    }

    /** KB 테이블을 삭제하고 풀을 닫는다. 두 번째 호출부터는 아무것도 하지 않는다 */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            if (kb.isInitialized()) kb.remove();
        } finally {
            synchronized (poolLock) {
                if (dataSource != null) {
                    dataSource.close();
                    LOG.info("KB session closed: {}", cfg.getJdbcUrl());
                }
            }
        }
    }

    // DbKnowledgeBase.setup() 에서 kbLock 을 잡은 채로 호출된다
    private Dbms openDbms() {
        ensureOpen();
        synchronized (poolLock) {
            if (dataSource == null) dataSource = DataSources.sqlite(cfg);
            return new JdbiDbms(dataSource);
        }
    }

    private void ensureOpen() {
        if (closed.get()) throw new IllegalStateException("KbSession is closed");
    }
}
