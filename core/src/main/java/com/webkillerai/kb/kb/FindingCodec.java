package com.webkillerai.kb.kb;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.webkillerai.kb.model.Finding;
import com.webkillerai.kb.model.InfoSet;
import com.webkillerai.kb.util.Hashes;
import com.webkillerai.kb.util.JsonMappers;

import java.io.IOException;
import java.lang.reflect.Array;
import java.util.Objects;

/**
 * KB 레코드 blob 직렬화.
 *
 * blob 은 JSON 봉투 하나:
 *   {"finding": {..., "@kind": "info"}}   Finding 변형
 *   {"raw": <json>}                        rawWrite 값 (String/Number/Boolean/List/Map 으로 복원)
 *
 * Shell 의 HTTP 클라이언트/워커 풀은 직렬화 대상이 아니다.
 */
public final class FindingCodec {

    private final ObjectMapper om;

    public FindingCodec() {
        this(JsonMappers.standard());
    }

    public FindingCodec(ObjectMapper om) {
        this.om = Objects.requireNonNull(om, "om");
    }

    /** 사용자 정의 InfoSet 하위 타입 등록. 첫 사용 전에 호출할 것 */
    public FindingCodec registerSubtype(Class<? extends InfoSet> type, String kind) {
        om.registerSubtypes(new NamedType(type, kind));
        return this;
    }

    public ObjectMapper mapper() { return om; }

    public byte[] encode(Object value) {
        Objects.requireNonNull(value, "value");
        try {
            Envelope env = (value instanceof Finding f)
                    ? new Envelope(f, null)
                    : new Envelope(null, om.valueToTree(value));
            return om.writeValueAsBytes(env);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    /** @return Finding 또는 일반 JSON 값 */
    public Object decode(byte[] blob) {
        Envelope env;
        try {
            env = om.readValue(blob, Envelope.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to decode KB record", e);
        }
        if (env.finding() != null) return env.finding();
        if (env.raw() != null && !env.raw().isNull()) {
            try {
                return om.treeToValue(env.raw(), Object.class);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to decode raw KB value", e);
            }
        }
        throw new IllegalStateException("Empty KB record envelope");
    }

    public <T> T convert(Object value, Class<T> type) {
        return om.convertValue(value, type);
    }

    /**
     * 내용 기반 식별자.
     *  - Finding: 자신의 getUniqId()
     *  - Iterable/배열: 원소 문자열을 이어 붙인 값의 해시
     *  - 그 외: 값 문자열의 해시
     */
    public static String uniqIdOf(Object value) {
        if (value instanceof Finding f) return f.getUniqId();

        if (value instanceof Iterable<?> it) {
            StringBuilder sb = new StringBuilder();
            for (Object o : it) sb.append(o);
            return Hashes.sha1Hex(sb.toString());
        }
        if (value != null && value.getClass().isArray()) {
            StringBuilder sb = new StringBuilder();
            int n = Array.getLength(value);
            for (int i = 0; i < n; i++) sb.append(Array.get(value, i));
            return Hashes.sha1Hex(sb.toString());
        }
        return Hashes.sha1Hex(String.valueOf(value));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Envelope(@JsonProperty("finding") Finding finding,
                    @JsonProperty("raw") JsonNode raw) {}
}
