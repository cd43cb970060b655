package com.webkillerai.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.time.Instant;

/** 확인된 보안 이슈. 심각도는 LOW/MEDIUM/HIGH 중 하나 */
public final class Vuln extends Info {

    @JsonCreator
    Vuln(@JsonProperty("uniqId") String uniqId,
         @JsonProperty("name") String name,
         @JsonProperty("severity") Severity severity,
         @JsonProperty("url") URI url,
         @JsonProperty("tokenName") String tokenName,
         @JsonProperty("dc") DataContainer dc,
         @JsonProperty("description") String description,
         @JsonProperty("pluginName") String pluginName,
         @JsonProperty("detectedAt") Instant detectedAt) {
        super(uniqId, name, severity, url, tokenName, dc, description, pluginName, detectedAt);
        if (!severity.isVulnLevel()) {
            throw new IllegalArgumentException("Vuln severity must be LOW, MEDIUM or HIGH: " + severity);
        }
    }

    private Vuln(Vuln other) { super(other); }

    @Override
    public Vuln copy() { return new Vuln(this); }
}
