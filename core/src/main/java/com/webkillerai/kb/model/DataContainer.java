package com.webkillerai.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 요청 파라미터 컨테이너(query string / form body).
 * 키 집합이 요청의 "모양"을 나타낸다. 순서는 보존하지만 비교는 집합 기준.
 */
public final class DataContainer {

    private final Map<String, List<String>> params;

    @JsonCreator
    public DataContainer(@JsonProperty("params") Map<String, List<String>> params) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (params != null) {
            params.forEach((k, v) -> copy.put(k, v == null ? List.of() : List.copyOf(v)));
        }
        this.params = Collections.unmodifiableMap(copy);
    }

    public static DataContainer of(String... kv) {
        Map<String, List<String>> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.computeIfAbsent(kv[i], k -> new ArrayList<>()).add(kv[i + 1]);
        }
        return new DataContainer(m);
    }

    public Map<String, List<String>> getParams() { return params; }

    @JsonIgnore
    public Set<String> keys() { return new LinkedHashSet<>(params.keySet()); }

    /** 키 집합 비교 (순서 무관) */
    public boolean sameKeys(DataContainer other) {
        return other != null && params.keySet().equals(other.params.keySet());
    }

    @JsonIgnore
    public boolean isEmpty() { return params.isEmpty(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataContainer dc)) return false;
        return params.equals(dc.params);
    }

    @Override
    public int hashCode() { return Objects.hash(params); }

    @Override
    public String toString() { return "DataContainer" + params; }
}
