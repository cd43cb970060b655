package com.webkillerai.kb.db;

import java.util.Objects;

/** 테이블 컬럼 정의. type 에는 제약까지 포함할 수 있다(예: "TEXT NOT NULL UNIQUE") */
public record Column(String name, String type) {
    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    public String ddl() { return name + " " + type; }
}
