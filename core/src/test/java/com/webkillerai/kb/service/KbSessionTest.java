package com.webkillerai.kb.service;

import com.webkillerai.kb.kb.KnowledgeBase;
import com.webkillerai.kb.model.Info;
import com.webkillerai.kb.model.KbConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class KbSessionTest {

    @TempDir
    Path tmp;

    private KbConfig cfg() {
        return KbConfig.defaults().setDbPath(tmp.resolve("session/kb.sqlite")).setPoolSize(2);
    }

    @Test
    void pool_opens_only_on_first_use() {
        try (KbSession session = KbSession.open(cfg())) {
            KnowledgeBase kb = session.knowledgeBase();
            assertThat(session.isPoolOpen()).isFalse();
            assertThat(kb.isInitialized()).isFalse();

            kb.append("p", "b", Info.builder().name("x").build());

            assertThat(session.isPoolOpen()).isTrue();
            assertThat(kb.get("p", "b")).hasSize(1);
        }
    }

    @Test
    void reset_clears_data_for_reuse() {
        try (KbSession session = KbSession.open(cfg())) {
            KnowledgeBase kb = session.knowledgeBase();
            kb.append("p", "b", Info.builder().name("x").build());
            kb.addUrl(URI.create("http://t/"));

            session.reset();

            assertThat(kb.dump()).isEmpty();
            assertThat(kb.getAllKnownUrls().size()).isZero();
        }
    }

    @Test
    void close_tears_down_and_rejects_further_use() {
        KbSession session = KbSession.open(cfg());
        KnowledgeBase kb = session.knowledgeBase();
        kb.append("p", "b", Info.builder().name("x").build());

        session.close();
        session.close();

        assertThat(session.isPoolOpen()).isFalse();
        assertThat(kb.isInitialized()).isFalse();
        assertThatThrownBy(session::knowledgeBase).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void closing_an_unused_session_is_harmless() {
        KbSession session = KbSession.open(cfg());
        session.close();
        assertThat(tmp.resolve("session/kb.sqlite")).doesNotExist();
    }
}
