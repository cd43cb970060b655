package com.webkillerai.kb.model;

/**
 * KB 락 적용 범위.
 *  - COMPOSITE_ONLY: appendUniq/appendUniqGroup/setup 만 락을 잡는다(기본, 기존 동작)
 *  - ALL_OPERATIONS: append/get/update/raw* 와 전체 스캔까지 같은 락으로 직렬화
 */
public enum LockPolicy {
    COMPOSITE_ONLY,
    ALL_OPERATIONS
}
