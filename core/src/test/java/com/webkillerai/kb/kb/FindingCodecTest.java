package com.webkillerai.kb.kb;

import com.webkillerai.kb.model.DataContainer;
import com.webkillerai.kb.model.Finding;
import com.webkillerai.kb.model.Info;
import com.webkillerai.kb.model.InfoSet;
import com.webkillerai.kb.model.ParamInfoSet;
import com.webkillerai.kb.model.Severity;
import com.webkillerai.kb.model.Shell;
import com.webkillerai.kb.model.Vuln;
import com.webkillerai.kb.util.Hashes;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.webkillerai.kb.kb.KbTestSupport.info;
import static com.webkillerai.kb.kb.KbTestSupport.vuln;
import static org.assertj.core.api.Assertions.*;

class FindingCodecTest {

    private final FindingCodec codec = new FindingCodec();

    @Test
    void finding_variants_keep_their_runtime_type() {
        Info i = info("x", "http://t/a", "q", DataContainer.of("q", "1"));
        Vuln v = vuln("sqli", Severity.HIGH, "http://t/b", "id");
        InfoSet set = new InfoSet(List.of(i, v));
        ParamInfoSet pset = new ParamInfoSet(List.of(i));

        for (Finding f : List.of(i, v, set, pset)) {
            Object back = codec.decode(codec.encode(f));
            assertThat(back).isExactlyInstanceOf(f.getClass()).isEqualTo(f);
        }
    }

    @Test
    void blob_is_tagged_by_kind() {
        String json = new String(codec.encode(vuln("sqli", Severity.LOW, "http://t", "id")), StandardCharsets.UTF_8);
        assertThat(json).contains("\"finding\"").contains("\"@kind\":\"vuln\"");

        String raw = new String(codec.encode(List.of(1, 2)), StandardCharsets.UTF_8);
        assertThat(raw).isEqualTo("{\"raw\":[1,2]}");
    }

    @Test
    void shell_live_handles_are_not_serialized() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Shell live = new Shell(null, "rce", URI.create("http://t/x"), "cmd", null, "eval")
                    .attach(HttpClient.newHttpClient(), pool);

            String json = new String(codec.encode(live), StandardCharsets.UTF_8);
            Shell back = (Shell) codec.decode(codec.encode(live));

            assertThat(json).doesNotContain("urlOpener").doesNotContain("workerPool").doesNotContain("live");
            assertThat(back).isEqualTo(live);
            assertThat(back.isLive()).isFalse();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void raw_values_come_back_as_plain_json_values() {
        assertThat(codec.decode(codec.encode("text"))).isEqualTo("text");
        assertThat(codec.decode(codec.encode(7))).isEqualTo(7);
        assertThat(codec.decode(codec.encode(true))).isEqualTo(true);
        assertThat(codec.decode(codec.encode(List.of("a", "b")))).isEqualTo(List.of("a", "b"));
        assertThat(codec.decode(codec.encode(Map.of("k", "v")))).isEqualTo(Map.of("k", "v"));
    }

    @Test
    void corrupt_blob_fails_loudly() {
        assertThatThrownBy(() -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> codec.decode("{}".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void uniq_id_follows_content() {
        Info i = info("x", "http://t", null);
        assertThat(FindingCodec.uniqIdOf(i)).isEqualTo(i.getUniqId());

        String ab = Hashes.sha1Hex("ab");
        assertThat(FindingCodec.uniqIdOf(List.of("a", "b"))).isEqualTo(ab);
        assertThat(FindingCodec.uniqIdOf(new String[]{"a", "b"})).isEqualTo(ab);
        assertThat(FindingCodec.uniqIdOf(12)).isEqualTo(Hashes.sha1Hex("12"));
    }
}
