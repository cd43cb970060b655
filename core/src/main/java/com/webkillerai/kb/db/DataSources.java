package com.webkillerai.kb.db;

import com.webkillerai.kb.model.KbConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** SQLite 파일 DB 커넥션 풀 생성 */
public final class DataSources {

    private static final Logger LOG = LoggerFactory.getLogger(DataSources.class);

    private DataSources() {}

    /** 호출자가 close() 책임을 진다 */
    public static HikariDataSource sqlite(KbConfig cfg) {
        cfg.validate();
        Path parent = cfg.getDbPath().toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new DbException("Cannot create DB directory: " + parent, e);
            }
        }

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(cfg.getJdbcUrl());
        config.setPoolName("wk-kb");
        config.setMaximumPoolSize(cfg.getPoolSize());
        config.setConnectionTestQuery("SELECT 1");
        // sqlite-jdbc 는 드라이버 프로퍼티로 PRAGMA 를 받는다
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(cfg.getBusyTimeoutMs()));

        LOG.info("Opening KB database: {} (pool={})", cfg.getJdbcUrl(), cfg.getPoolSize());
        return new HikariDataSource(config);
    }
}
