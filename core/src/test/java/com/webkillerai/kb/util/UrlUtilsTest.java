package com.webkillerai.kb.util;

import com.webkillerai.kb.model.DataContainer;
import com.webkillerai.kb.model.FuzzableRequest;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;

class UrlUtilsTest {

    @Test
    void normalize_lowercases_and_drops_defaults() {
        assertThat(UrlUtils.normalize(URI.create("HTTPS://Example.COM:443//a//b#top")))
                .isEqualTo(URI.create("https://example.com/a/b"));
        assertThat(UrlUtils.normalize(URI.create("http://example.com"))).isEqualTo(URI.create("http://example.com/"));
        assertThat(UrlUtils.normalize(URI.create("http://example.com:8080/x?q=1")))
                .isEqualTo(URI.create("http://example.com:8080/x?q=1"));
        assertThat(UrlUtils.normalize(null)).isNull();
    }

    @Test
    void normalize_keeps_encoded_query_path_and_userinfo() {
        assertThat(UrlUtils.urlKey(URI.create("http://t/a?x=%26y")))
                .isEqualTo("http://t/a?x=%26y")
                .isNotEqualTo(UrlUtils.urlKey(URI.create("http://t/a?x=&y")));
        assertThat(UrlUtils.urlKey(URI.create("http://t/a%2Fb"))).isNotEqualTo(UrlUtils.urlKey(URI.create("http://t/a/b")));
        assertThat(UrlUtils.normalize(URI.create("http://admin:pw@T:80/x")))
                .isEqualTo(URI.create("http://admin:pw@t/x"));
        assertThat(UrlUtils.normalize(URI.create("mailto:a@b"))).isEqualTo(URI.create("mailto:a@b"));
    }

    @Test
    void request_shape_splits_only_on_literal_ampersands() {
        FuzzableRequest encoded = FuzzableRequest.get(URI.create("http://t/s?x=%26y"));
        FuzzableRequest split = FuzzableRequest.get(URI.create("http://t/s?x=&y"));

        assertThat(UrlUtils.requestShapeKey(encoded)).isEqualTo("GET http://t/s q=x dc=");
        assertThat(UrlUtils.requestShapeKey(split)).isEqualTo("GET http://t/s q=x,y dc=");
    }

    @Test
    void request_shape_ignores_parameter_values_and_order() {
        FuzzableRequest a = FuzzableRequest.get(URI.create("http://t/s?b=1&a=2"));
        FuzzableRequest b = FuzzableRequest.get(URI.create("http://t/s?a=9&b=8"));
        FuzzableRequest c = FuzzableRequest.get(URI.create("http://t/s?a=9"));

        assertThat(UrlUtils.requestShapeKey(a)).isEqualTo(UrlUtils.requestShapeKey(b));
        assertThat(UrlUtils.requestShapeKey(a)).isNotEqualTo(UrlUtils.requestShapeKey(c));
        assertThat(UrlUtils.requestShapeKey(a)).isEqualTo("GET http://t/s q=a,b dc=");
    }

    @Test
    void request_shape_separates_methods_and_body_keys() {
        URI login = URI.create("http://t/login");
        String post = UrlUtils.requestShapeKey(FuzzableRequest.post(login, DataContainer.of("user", "a", "pw", "b")));
        String get = UrlUtils.requestShapeKey(FuzzableRequest.get(login));
        String other = UrlUtils.requestShapeKey(FuzzableRequest.post(login, DataContainer.of("user", "a")));

        assertThat(post).isEqualTo("POST http://t/login q= dc=pw,user");
        assertThat(post).isNotEqualTo(get).isNotEqualTo(other);
    }
}
