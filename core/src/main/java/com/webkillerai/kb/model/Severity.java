package com.webkillerai.kb.model;

import java.util.EnumSet;
import java.util.Set;

/** 결과 심각도. INFORMATION 은 정보성 관찰, 나머지는 취약점 등급 */
public enum Severity {
    INFORMATION,
    LOW,
    MEDIUM,
    HIGH;

    /** getAllVulns() 가 모으는 등급 */
    public static final Set<Severity> VULN_LEVELS = EnumSet.of(LOW, MEDIUM, HIGH);

    public boolean isVulnLevel() { return VULN_LEVELS.contains(this); }
}
