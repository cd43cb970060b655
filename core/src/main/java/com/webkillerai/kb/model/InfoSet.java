package com.webkillerai.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.webkillerai.kb.util.Hashes;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 같은 그룹 규칙으로 묶인 Info 묶음.
 *  - 대표값(이름/URL/토큰/심각도)은 첫 번째 Info 를 따른다
 *  - match(info): 기본 규칙은 이름 일치. 하위 클래스가 규칙을 좁힌다
 *  - uniqId 는 구성원 식별자에서 파생되므로 add() 후 바뀐다
 *
 * 하위 클래스는 withInfos() 를 재정의해야 copy() 가 타입을 유지한다.
 */
public non-sealed class InfoSet implements Finding, SeverityAware {

    private final List<Info> infos;

    @JsonCreator
    public InfoSet(@JsonProperty("infos") List<Info> infos) {
        if (infos == null || infos.isEmpty()) {
            throw new IllegalArgumentException("InfoSet requires at least one Info");
        }
        this.infos = new ArrayList<>(infos);
    }

    public List<Info> getInfos() { return Collections.unmodifiableList(infos); }

    @JsonIgnore
    public Info getFirstInfo() { return infos.get(0); }

    @JsonIgnore
    public int size() { return infos.size(); }

    public boolean match(Info info) {
        return info != null && getName().equals(info.getName());
    }

    public void add(Info info) {
        infos.add(Objects.requireNonNull(info, "info"));
    }

    @JsonIgnore
    @Override
    public String getUniqId() {
        StringBuilder sb = new StringBuilder(infos.size() * 37);
        for (Info i : infos) sb.append(i.getUniqId());
        return Hashes.sha1Hex(sb.toString());
    }

    @JsonIgnore @Override public String getName() { return getFirstInfo().getName(); }
    @JsonIgnore @Override public URI getUrl() { return getFirstInfo().getUrl(); }
    @JsonIgnore @Override public String getTokenName() { return getFirstInfo().getTokenName(); }
    @JsonIgnore @Override public DataContainer getDc() { return getFirstInfo().getDc(); }
    @JsonIgnore @Override public Severity getSeverity() { return getFirstInfo().getSeverity(); }

    @Override
    public InfoSet copy() {
        List<Info> copies = new ArrayList<>(infos.size());
        for (Info i : infos) copies.add(i.copy());
        return withInfos(copies);
    }

    protected InfoSet withInfos(List<Info> infos) { return new InfoSet(infos); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return infos.equals(((InfoSet) o).infos);
    }

    @Override
    public int hashCode() { return infos.hashCode(); }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + getName() + ", size=" + infos.size() + "]";
    }
}
