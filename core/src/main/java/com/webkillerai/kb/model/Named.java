package com.webkillerai.kb.model;

/** 이름으로 식별되는 엔티티(보통 플러그인). KB 주소의 location_a 로 쓰인다. */
@FunctionalInterface
public interface Named {
    String getName();
}
