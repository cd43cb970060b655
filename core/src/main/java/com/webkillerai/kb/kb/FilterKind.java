package com.webkillerai.kb.kb;

import com.webkillerai.kb.model.DataContainer;
import com.webkillerai.kb.model.Finding;
import com.webkillerai.kb.model.Info;

import java.util.Locale;
import java.util.Objects;

/**
 * appendUniq 중복 판정 규칙.
 *  - URL: 같은 URL 이면 중복
 *  - VAR: 같은 URL + 같은 파라미터(token) + 같은 dc 키 집합이면 중복
 *         (dc 가 한쪽만 있으면 중복 아님)
 */
public enum FilterKind {

    URL {
        @Override
        public boolean matches(Finding saved, Info candidate) {
            return Objects.equals(saved.getUrl(), candidate.getUrl());
        }
    },

    VAR {
        @Override
        public boolean matches(Finding saved, Info candidate) {
            if (!Objects.equals(saved.getTokenName(), candidate.getTokenName())) return false;
            if (!Objects.equals(saved.getUrl(), candidate.getUrl())) return false;

            DataContainer a = saved.getDc();
            DataContainer b = candidate.getDc();
            if (a == null && b == null) return true;
            return a != null && a.sameKeys(b);
        }
    };

    /** saved 가 candidate 와 같은 등가 클래스면 true */
    public abstract boolean matches(Finding saved, Info candidate);

    /** 설정 문자열("url", "VAR") → FilterKind */
    public static FilterKind of(String name) {
        if (name != null) {
            for (FilterKind k : values()) {
                if (k.name().equals(name.trim().toUpperCase(Locale.ROOT))) return k;
            }
        }
        throw new IllegalArgumentException("appendUniq only knows about URL or VAR filters, got: " + name);
    }
}
