package com.webkillerai.kb.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * 익스플로잇으로 얻은 세션 핸들.
 * 저장되는 것은 식별/상태 값뿐이고, HTTP 클라이언트와 워커 풀은 저장하지 않는다.
 * KB 에서 꺼낸 뒤 attach() 로 다시 붙여야 사용 가능(isLive()).
 */
public final class Shell implements Finding {

    private final String uniqId;
    private final String name;
    private final URI url;
    private final String tokenName;
    private final DataContainer dc;
    private final String exploitMethod;

    private transient HttpClient urlOpener;
    private transient ExecutorService workerPool;

    @JsonCreator
    public Shell(@JsonProperty("uniqId") String uniqId,
                 @JsonProperty("name") String name,
                 @JsonProperty("url") URI url,
                 @JsonProperty("tokenName") String tokenName,
                 @JsonProperty("dc") DataContainer dc,
                 @JsonProperty("exploitMethod") String exploitMethod) {
        this.uniqId = (uniqId == null || uniqId.isBlank()) ? UUID.randomUUID().toString() : uniqId;
        this.name = Objects.requireNonNull(name, "name");
        this.url = url;
        this.tokenName = tokenName;
        this.dc = dc;
        this.exploitMethod = exploitMethod;
    }

    /** 익스플로잇된 Vuln 으로부터 생성 */
    public static Shell fromVuln(Vuln vuln, String exploitMethod, HttpClient urlOpener, ExecutorService workerPool) {
        Shell s = new Shell(null, vuln.getName(), vuln.getUrl(), vuln.getTokenName(), vuln.getDc(), exploitMethod);
        s.attach(urlOpener, workerPool);
        return s;
    }

    @Override public String getUniqId() { return uniqId; }
    @Override public String getName() { return name; }
    @Override public URI getUrl() { return url; }
    @Override public String getTokenName() { return tokenName; }
    @Override public DataContainer getDc() { return dc; }
    public String getExploitMethod() { return exploitMethod; }

    @JsonIgnore public HttpClient getUrlOpener() { return urlOpener; }
    @JsonIgnore public ExecutorService getWorkerPool() { return workerPool; }

    public void setUrlOpener(HttpClient urlOpener) { this.urlOpener = urlOpener; }
    public void setWorkerPool(ExecutorService workerPool) { this.workerPool = workerPool; }

    public Shell attach(HttpClient urlOpener, ExecutorService workerPool) {
        setUrlOpener(urlOpener);
        setWorkerPool(workerPool);
        return this;
    }

    @JsonIgnore
    public boolean isLive() { return urlOpener != null && workerPool != null; }

    /** 라이브 핸들까지 그대로 공유하는 복사본 */
    @Override
    public Shell copy() {
        Shell s = new Shell(uniqId, name, url, tokenName, dc, exploitMethod);
        s.attach(urlOpener, workerPool);
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Shell s)) return false;
        return uniqId.equals(s.uniqId) && name.equals(s.name)
                && Objects.equals(url, s.url) && Objects.equals(exploitMethod, s.exploitMethod);
    }

    @Override
    public int hashCode() { return Objects.hash(uniqId, name, url); }

    @Override
    public String toString() { return "Shell[" + name + ", url=" + url + ", live=" + isLive() + "]"; }
}
