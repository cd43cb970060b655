package com.webkillerai.kb.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.net.URI;

/**
 * 플러그인 사이에서 KB 를 통해 공유되는 결과 단위.
 * 변형은 Info(+Vuln), InfoSet, Shell 로 닫혀 있다.
 *
 * "@kind" 속성으로 직렬화 시 변형을 구분한다. InfoSet 하위 타입은
 * FindingCodec.registerSubtype 으로 추가 등록한다.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "@kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Info.class, name = "info"),
        @JsonSubTypes.Type(value = Vuln.class, name = "vuln"),
        @JsonSubTypes.Type(value = InfoSet.class, name = "info_set"),
        @JsonSubTypes.Type(value = ParamInfoSet.class, name = "param_info_set"),
        @JsonSubTypes.Type(value = Shell.class, name = "shell")
})
public sealed interface Finding permits Info, InfoSet, Shell {

    /** 내용 기반 식별자. update() 대상 지정에 사용 */
    String getUniqId();

    String getName();

    URI getUrl();

    /** 관련 파라미터 이름(없으면 null) */
    String getTokenName();

    /** 요청 파라미터 컨테이너(없으면 null) */
    DataContainer getDc();

    /** 깊은 복사. 식별자는 그대로 유지 */
    Finding copy();
}
