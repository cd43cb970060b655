package com.webkillerai.kb.util;

import java.security.SecureRandom;

/** 테이블 이름 충돌 방지용 랜덤 알파벳 문자열 */
public final class RandomNames {
    private static final char[] ALPHA = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".toCharArray();
    private static final SecureRandom RND = new SecureRandom();

    private RandomNames() {}

    public static String randAlpha(int length) {
        if (length < 1) throw new IllegalArgumentException("length must be >= 1");
        char[] out = new char[length];
        for (int i = 0; i < length; i++) out[i] = ALPHA[RND.nextInt(ALPHA.length)];
        return new String(out);
    }

    /** prefix + "_" 없이 그대로 이어 붙인다 (예: knowledge_base_AbCd...) */
    public static String tableName(String prefix, int length) {
        return prefix + randAlpha(length);
    }
}
