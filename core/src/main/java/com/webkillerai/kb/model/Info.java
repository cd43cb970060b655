package com.webkillerai.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * 정보성 관찰 결과.
 * uniqId 는 생성 시 한 번 부여되고 copy() 로도 유지된다(저장 내용의 일부).
 */
public sealed class Info implements Finding, SeverityAware permits Vuln {

    private final String uniqId;
    private final String name;
    private final Severity severity;
    private final URI url;
    private final String tokenName;
    private final DataContainer dc;
    private final String description;
    private final String pluginName;
    private final Instant detectedAt;

    @JsonCreator
    protected Info(@JsonProperty("uniqId") String uniqId,
                   @JsonProperty("name") String name,
                   @JsonProperty("severity") Severity severity,
                   @JsonProperty("url") URI url,
                   @JsonProperty("tokenName") String tokenName,
                   @JsonProperty("dc") DataContainer dc,
                   @JsonProperty("description") String description,
                   @JsonProperty("pluginName") String pluginName,
                   @JsonProperty("detectedAt") Instant detectedAt) {
        this.uniqId = (uniqId == null || uniqId.isBlank()) ? UUID.randomUUID().toString() : uniqId;
        this.name = Objects.requireNonNull(name, "name");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.url = url;
        this.tokenName = tokenName;
        this.dc = dc;
        this.description = description;
        this.pluginName = pluginName;
        this.detectedAt = (detectedAt == null ? Instant.now() : detectedAt);
    }

    protected Info(Info other) {
        this(other.uniqId, other.name, other.severity, other.url, other.tokenName,
             other.dc, other.description, other.pluginName, other.detectedAt);
    }

    @Override public String getUniqId() { return uniqId; }
    @Override public String getName() { return name; }
    @Override public Severity getSeverity() { return severity; }
    @Override public URI getUrl() { return url; }
    @Override public String getTokenName() { return tokenName; }
    @Override public DataContainer getDc() { return dc; }
    public String getDescription() { return description; }
    public String getPluginName() { return pluginName; }
    public Instant getDetectedAt() { return detectedAt; }

    // DataContainer 는 불변이므로 얕은 복사로 충분
    @Override
    public Info copy() { return new Info(this); }

    public static Builder builder() { return new Builder(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        Info i = (Info) o;
        return uniqId.equals(i.uniqId)
                && name.equals(i.name)
                && severity == i.severity
                && Objects.equals(url, i.url)
                && Objects.equals(tokenName, i.tokenName)
                && Objects.equals(dc, i.dc)
                && Objects.equals(description, i.description)
                && Objects.equals(pluginName, i.pluginName);
    }

    @Override
    public int hashCode() { return Objects.hash(uniqId, name, severity, url, tokenName); }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + severity + ", url=" + url
                + ", token=" + tokenName + ", id=" + uniqId + "]";
    }

    public static final class Builder {
        private String uniqId;
        private String name;
        private Severity severity = Severity.INFORMATION;
        private URI url;
        private String tokenName;
        private DataContainer dc;
        private String description;
        private String pluginName;
        private Instant detectedAt;

        public Builder uniqId(String uniqId) { this.uniqId = uniqId; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder url(URI url) { this.url = url; return this; }
        public Builder url(String url) { this.url = URI.create(url); return this; }
        public Builder tokenName(String tokenName) { this.tokenName = tokenName; return this; }
        public Builder dc(DataContainer dc) { this.dc = dc; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder pluginName(String pluginName) { this.pluginName = pluginName; return this; }
        public Builder detectedAt(Instant detectedAt) { this.detectedAt = detectedAt; return this; }

        public Info build() {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(severity, "severity");
            return new Info(uniqId, name, severity, url, tokenName, dc, description, pluginName, detectedAt);
        }

        /** 심각도가 LOW 이상이어야 한다 */
        public Vuln buildVuln() {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(severity, "severity");
            return new Vuln(uniqId, name, severity, url, tokenName, dc, description, pluginName, detectedAt);
        }
    }
}
