package com.webkillerai.kb.db;

/** 저장소 계층 실패(SQL 오류, 갱신 대상 식별자 없음 등) */
public class DbException extends RuntimeException {
    public DbException(String message) { super(message); }
    public DbException(String message, Throwable cause) { super(message, cause); }
}
