package com.webkillerai.kb.model;

/**
 * 심각도를 가진 Finding.
 * Shell 은 구현하지 않으므로 심각도 기반 조회(getAllVulns/getAllInfos)에서 빠진다.
 */
public interface SeverityAware {
    Severity getSeverity();
}
