package com.webkillerai.kb.db;

import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.statement.Query;
import org.jdbi.v3.core.statement.SqlStatement;
import org.jdbi.v3.core.statement.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Jdbi + SQLite 기반 Dbms.
 * 문장마다 autocommit 이므로 commit() 은 WAL 체크포인트만 수행한다.
 */
public final class JdbiDbms implements Dbms {

    private static final Logger LOG = LoggerFactory.getLogger(JdbiDbms.class);

    private final Jdbi jdbi;

    public JdbiDbms(DataSource dataSource) {
        this(Jdbi.create(Objects.requireNonNull(dataSource, "dataSource")));
    }

    public JdbiDbms(Jdbi jdbi) {
        this.jdbi = Objects.requireNonNull(jdbi, "jdbi");
    }

    @Override
    public void createTable(String name, List<Column> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("createTable requires at least one column");
        }
        String ddl = columns.stream().map(Column::ddl).collect(Collectors.joining(", "));
        run("CREATE TABLE IF NOT EXISTS " + name + " (" + ddl + ")");
        LOG.debug("Created table {} ({})", name, ddl);
    }

    @Override
    public void createIndex(String table, List<String> columns) {
        String idx = "idx_" + table + "_" + String.join("_", columns);
        run("CREATE INDEX IF NOT EXISTS " + idx + " ON " + table + " (" + String.join(", ", columns) + ")");
    }

    @Override
    public int execute(String sql, Object... params) {
        try {
            return jdbi.withHandle(h -> {
                Update u = h.createUpdate(sql);
                bindAll(u, params);
                return u.execute();
            });
        } catch (JdbiException e) {
            throw new DbException("SQL execute failed: " + sql, e);
        }
    }

    @Override
    public List<Map<String, Object>> select(String sql, Object... params) {
        try {
            return jdbi.withHandle(h -> {
                Query q = h.createQuery(sql);
                bindAll(q, params);
                return q.mapToMap().list();
            });
        } catch (JdbiException e) {
            throw new DbException("SQL select failed: " + sql, e);
        }
    }

    @Override
    public Optional<Map<String, Object>> selectOne(String sql, Object... params) {
        try {
            return jdbi.withHandle(h -> {
                Query q = h.createQuery(sql);
                bindAll(q, params);
                return q.mapToMap().findFirst();
            });
        } catch (JdbiException e) {
            throw new DbException("SQL select failed: " + sql, e);
        }
    }

    @Override
    public void dropTable(String name) {
        run("DROP TABLE IF EXISTS " + name);
        LOG.debug("Dropped table {}", name);
    }

    @Override
    public void commit() {
        try {
            jdbi.useHandle(h -> h.createQuery("PRAGMA wal_checkpoint(PASSIVE)").mapToMap().list());
        } catch (JdbiException e) {
            throw new DbException("WAL checkpoint failed", e);
        }
    }

    private void run(String sql) {
        try {
            jdbi.useHandle(h -> h.execute(sql));
        } catch (JdbiException e) {
            throw new DbException("SQL failed: " + sql, e);
        }
    }

    private static void bindAll(SqlStatement<?> stmt, Object... params) {
        if (params == null) return;
        for (int i = 0; i < params.length; i++) {
            stmt.bind(i, params[i]);
        }
    }
}
