package com.webkillerai.kb.kb;

import com.webkillerai.kb.db.DataSources;
import com.webkillerai.kb.db.JdbiDbms;
import com.webkillerai.kb.model.DataContainer;
import com.webkillerai.kb.model.Info;
import com.webkillerai.kb.model.KbConfig;
import com.webkillerai.kb.model.Severity;
import com.webkillerai.kb.model.Vuln;
import com.zaxxer.hikari.HikariDataSource;

import java.nio.file.Path;

/** 임시 디렉터리의 SQLite 파일 위에 KB 를 띄우는 테스트 헬퍼 */
final class KbTestSupport implements AutoCloseable {

    final KbConfig cfg;
    final HikariDataSource ds;
    final CountingDbms dbms;

    KbTestSupport(Path dir) {
        this(KbConfig.defaults().setDbPath(dir.resolve("kb.sqlite")));
    }

    KbTestSupport(KbConfig cfg) {
        this.cfg = cfg;
        this.ds = DataSources.sqlite(cfg);
        this.dbms = new CountingDbms(new JdbiDbms(ds));
    }

    DbKnowledgeBase newKb() {
        return new DbKnowledgeBase(cfg, () -> dbms);
    }

    static Info info(String name, String url, String token) {
        return Info.builder().name(name).url(url).tokenName(token).pluginName("test").build();
    }

    static Info info(String name, String url, String token, DataContainer dc) {
        return Info.builder().name(name).url(url).tokenName(token).dc(dc).build();
    }

    static Vuln vuln(String name, Severity sev, String url, String token) {
        return Info.builder().name(name).severity(sev).url(url).tokenName(token).buildVuln();
    }

    @Override
    public void close() {
        ds.close();
    }
}
