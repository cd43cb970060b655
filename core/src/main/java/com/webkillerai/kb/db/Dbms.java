package com.webkillerai.kb.db;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * KB 가 사용하는 관계형 저장소 어댑터.
 * SQL 의 파라미터는 위치 기반(?) 으로 바인딩한다. 행은 소문자 컬럼명 → 값 맵.
 */
public interface Dbms {

    void createTable(String name, List<Column> columns);

    void createIndex(String table, List<String> columns);

    /** @return 영향받은 행 수 */
    int execute(String sql, Object... params);

    List<Map<String, Object>> select(String sql, Object... params);

    Optional<Map<String, Object>> selectOne(String sql, Object... params);

    void dropTable(String name);

    /** 지금까지의 쓰기를 영속화 */
    void commit();
}
