package com.webkillerai.kb.model;

import java.net.http.HttpClient;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/** Shell 재수화에 필요한 현재 스캔의 라이브 자원 */
public record ShellRuntime(HttpClient urlOpener, ExecutorService workerPool) {
    public ShellRuntime {
        Objects.requireNonNull(urlOpener, "urlOpener");
        Objects.requireNonNull(workerPool, "workerPool");
    }
}
