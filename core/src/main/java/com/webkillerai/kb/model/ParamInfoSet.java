package com.webkillerai.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** 이름 + 파라미터(token) 가 같은 Info 만 묶는 그룹 */
public class ParamInfoSet extends InfoSet {

    @JsonCreator
    public ParamInfoSet(@JsonProperty("infos") List<Info> infos) {
        super(infos);
    }

    @Override
    public boolean match(Info info) {
        return super.match(info) && Objects.equals(getTokenName(), info.getTokenName());
    }

    @Override
    protected ParamInfoSet withInfos(List<Info> infos) { return new ParamInfoSet(infos); }
}
