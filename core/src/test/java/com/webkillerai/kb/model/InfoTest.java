package com.webkillerai.kb.model;

import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;

class InfoTest {

    @Test
    void builder_defaults_to_information_and_assigns_an_id() {
        Info i = Info.builder().name("Server header").url("http://t/").build();

        assertThat(i.getSeverity()).isEqualTo(Severity.INFORMATION);
        assertThat(i.getUniqId()).isNotBlank();
        assertThat(i.getUrl()).isEqualTo(URI.create("http://t/"));
        assertThat(i.getDetectedAt()).isNotNull();
    }

    @Test
    void copy_keeps_identity_and_content() {
        Info i = Info.builder().name("x").tokenName("q").dc(DataContainer.of("q", "1")).build();
        Info c = i.copy();

        assertThat(c).isNotSameAs(i).isEqualTo(i);
        assertThat(c.getUniqId()).isEqualTo(i.getUniqId());
    }

    @Test
    void distinct_infos_get_distinct_ids() {
        Info a = Info.builder().name("x").build();
        Info b = Info.builder().name("x").build();
        assertThat(a.getUniqId()).isNotEqualTo(b.getUniqId());
    }

    @Test
    void vuln_requires_a_vulnerability_level() {
        assertThatThrownBy(() -> Info.builder().name("x").buildVuln())
                .isInstanceOf(IllegalArgumentException.class);

        Vuln v = Info.builder().name("x").severity(Severity.MEDIUM).buildVuln();
        assertThat(v.copy()).isInstanceOf(Vuln.class).isEqualTo(v);
    }

    @Test
    void name_is_required() {
        assertThatThrownBy(() -> Info.builder().build()).isInstanceOf(NullPointerException.class);
    }
}
