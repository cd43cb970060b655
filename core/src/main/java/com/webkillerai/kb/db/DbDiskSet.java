package com.webkillerai.kb.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webkillerai.kb.util.RandomNames;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Dbms 테이블(key UNIQUE, blob) 위에 구현한 DiskSet.
 * 항목의 동일성은 keyFn 이 만든 문자열로 판단하고, 값은 Jackson 으로 저장한다.
 */
public final class DbDiskSet<T> implements DiskSet<T> {

    private static final int SUFFIX_LENGTH = 16;

    private final Dbms db;
    private final String table;
    private final Class<T> type;
    private final Function<T, String> keyFn;
    private final ObjectMapper om;
    private volatile boolean removed = false;

    public DbDiskSet(Dbms db, String tablePrefix, Class<T> type, Function<T, String> keyFn, ObjectMapper om) {
        this.db = Objects.requireNonNull(db, "db");
        this.type = Objects.requireNonNull(type, "type");
        this.keyFn = Objects.requireNonNull(keyFn, "keyFn");
        this.om = Objects.requireNonNull(om, "om");
        this.table = RandomNames.tableName(Objects.requireNonNull(tablePrefix, "tablePrefix") + "_", SUFFIX_LENGTH);

        db.createTable(table, List.of(
                new Column("item_key", "TEXT NOT NULL UNIQUE"),
                new Column("blob", "BLOB")));
    }

    public String getTableName() { return table; }

    @Override
    public boolean add(T item) {
        ensureAlive();
        Objects.requireNonNull(item, "item");
        byte[] blob;
        try {
            blob = om.writeValueAsBytes(item);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + type.getSimpleName(), e);
        }
        int rows = db.execute("INSERT OR IGNORE INTO " + table + " (item_key, blob) VALUES (?, ?)",
                keyFn.apply(item), blob);
        return rows == 1;
    }

    @Override
    public boolean contains(T item) {
        ensureAlive();
        if (item == null) return false;
        return db.selectOne("SELECT 1 AS hit FROM " + table + " WHERE item_key = ?", keyFn.apply(item)).isPresent();
    }

    @Override
    public int size() {
        ensureAlive();
        return db.selectOne("SELECT COUNT(*) AS n FROM " + table)
                .map(r -> ((Number) r.get("n")).intValue())
                .orElse(0);
    }

    @Override
    public Stream<T> stream() {
        return snapshot().stream();
    }

    @Override
    public Iterator<T> iterator() {
        return snapshot().iterator();
    }

    @Override
    public void cleanup() {
        if (removed) return;
        removed = true;
        db.dropTable(table);
    }

    private List<T> snapshot() {
        ensureAlive();
        List<Map<String, Object>> rows = db.select("SELECT blob FROM " + table + " ORDER BY rowid");
        List<T> out = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) {
            try {
                out.add(om.readValue((byte[]) r.get("blob"), type));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to decode " + type.getSimpleName() + " from " + table, e);
            }
        }
        return out;
    }

    private void ensureAlive() {
        if (removed) throw new IllegalStateException("DiskSet " + table + " was cleaned up");
    }
}
