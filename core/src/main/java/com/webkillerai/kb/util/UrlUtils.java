package com.webkillerai.kb.util;

import com.webkillerai.kb.model.DataContainer;
import com.webkillerai.kb.model.FuzzableRequest;

import java.net.URI;
import java.util.Locale;
import java.util.TreeSet;

/** URL 정규화 + 커버리지 셋 키 생성 */
public final class UrlUtils {
    private UrlUtils() {}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     * 경로/쿼리/userinfo 는 인코딩된 원문 그대로 둔다(%26 과 & 는 다른 URL).
     */
    public static URI normalize(URI u) {
        if (u == null) return null;
        if (u.isOpaque()) return u;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);

        StringBuilder sb = new StringBuilder(64).append(scheme).append("://");
        if (u.getHost() != null) {
            if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
            sb.append(u.getHost().toLowerCase(Locale.ROOT));
            int port = u.getPort();
            boolean defaultPort = (scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443);
            if (port != -1 && !defaultPort) sb.append(':').append(port);
        } else if (u.getRawAuthority() != null) {
            // 서버 기반으로 파싱되지 않는 authority(밑줄 호스트 등)
            sb.append(u.getRawAuthority().toLowerCase(Locale.ROOT));
        }

        String path = u.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        sb.append(path.replaceAll("/{2,}", "/"));

        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());

        try {
            return URI.create(sb.toString());
        } catch (IllegalArgumentException e) {
            // 파싱 실패 시 원본 유지
            return u;
        }
    }

    /** 알려진 URL 셋의 키 */
    public static String urlKey(URI u) {
        return normalize(u).toString();
    }

    /**
     * 요청 "모양" 키: METHOD + 쿼리 제외 URL + 정렬된 쿼리 파라미터명 + 정렬된 dc 키.
     * 값만 다른 요청은 같은 키가 된다.
     */
    public static String requestShapeKey(FuzzableRequest req) {
        URI n = normalize(req.url());
        String base = n.getScheme() + "://" + n.getRawAuthority() + n.getRawPath();

        TreeSet<String> queryNames = new TreeSet<>();
        String q = n.getRawQuery();
        if (q != null && !q.isEmpty()) {
            for (String pair : q.split("&")) {
                if (pair.isEmpty()) continue;
                int eq = pair.indexOf('=');
                queryNames.add(eq < 0 ? pair : pair.substring(0, eq));
            }
        }
        DataContainer dc = req.dc();
        TreeSet<String> dcKeys = (dc == null) ? new TreeSet<>() : new TreeSet<>(dc.keys());

        return req.method() + " " + base + " q=" + String.join(",", queryNames)
                + " dc=" + String.join(",", dcKeys);
    }
}
