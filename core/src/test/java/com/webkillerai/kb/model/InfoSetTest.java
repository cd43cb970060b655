package com.webkillerai.kb.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class InfoSetTest {

    private static Info info(String name, String token) {
        return Info.builder().name(name).url("http://t/").tokenName(token).build();
    }

    @Test
    void empty_set_is_rejected() {
        assertThatThrownBy(() -> new InfoSet(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void representative_values_come_from_first_info() {
        Info first = info("a", "q");
        InfoSet set = new InfoSet(List.of(first, info("a", "r")));

        assertThat(set.getName()).isEqualTo("a");
        assertThat(set.getTokenName()).isEqualTo("q");
        assertThat(set.getFirstInfo()).isSameAs(first);
    }

    @Test
    void add_changes_identity() {
        InfoSet set = new InfoSet(List.of(info("a", "q")));
        String before = set.getUniqId();
        set.add(info("a", "r"));

        assertThat(set.getUniqId()).isNotEqualTo(before);
        assertThat(set.size()).isEqualTo(2);
    }

    @Test
    void copy_is_independent() {
        InfoSet set = new InfoSet(List.of(info("a", "q")));
        InfoSet copy = set.copy();
        copy.add(info("a", "r"));

        assertThat(set.size()).isEqualTo(1);
        assertThat(copy.size()).isEqualTo(2);
    }

    @Test
    void default_match_is_by_name_and_param_set_narrows_by_token() {
        InfoSet byName = new InfoSet(List.of(info("a", "q")));
        assertThat(byName.match(info("a", "other"))).isTrue();
        assertThat(byName.match(info("b", "q"))).isFalse();

        ParamInfoSet byParam = new ParamInfoSet(List.of(info("a", "q")));
        assertThat(byParam.match(info("a", "q"))).isTrue();
        assertThat(byParam.match(info("a", "other"))).isFalse();
        assertThat(byParam.copy()).isInstanceOf(ParamInfoSet.class);
    }
}
