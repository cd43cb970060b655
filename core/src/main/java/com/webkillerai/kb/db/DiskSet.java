package com.webkillerai.kb.db;

import java.util.stream.Stream;

/**
 * 디스크 기반 중복 제거 집합.
 * 반복은 삽입 순서를 따르고 호출 시점의 스냅샷이다.
 */
public interface DiskSet<T> extends Iterable<T> {

    /** @return 새로 추가되었으면 true */
    boolean add(T item);

    boolean contains(T item);

    int size();

    Stream<T> stream();

    /** 저장 테이블 제거. 이후 사용 불가 */
    void cleanup();
}
