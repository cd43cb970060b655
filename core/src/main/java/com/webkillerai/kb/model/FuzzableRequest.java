package com.webkillerai.kb.model;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * 크롤/플러그인이 찾아낸 요청 모양.
 * dc 는 POST 본문 등 별도 파라미터 컨테이너(없으면 null).
 */
public record FuzzableRequest(String method, URI url, DataContainer dc) {

    public FuzzableRequest {
        Objects.requireNonNull(url, "url");
        method = (method == null || method.isBlank()) ? "GET" : method.toUpperCase(Locale.ROOT);
    }

    public static FuzzableRequest get(URI url) { return new FuzzableRequest("GET", url, null); }

    public static FuzzableRequest post(URI url, DataContainer dc) { return new FuzzableRequest("POST", url, dc); }
}
