package com.webkillerai.kb.util;

import com.webkillerai.kb.model.KbConfig;
import com.webkillerai.kb.model.LockPolicy;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * kb.yml 을 읽어 KbConfig 로 변환.
 *
 * 예상 YAML 키:
 * db:
 *   path: "out/kb/knowledge_base.sqlite"
 *   poolSize: 4
 *   busyTimeoutMs: 10000
 * tables:
 *   prefix: "knowledge_base_"
 *   suffixLength: 30
 *   urlSetPrefix: "kb_urls"
 *   requestSetPrefix: "kb_fuzzable_requests"
 * lockPolicy: COMPOSITE_ONLY | ALL_OPERATIONS
 *
 * 시스템 프로퍼티가 파일 값보다 우선:
 *   -Dwk.kb.dbPath=... -Dwk.kb.poolSize=N -Dwk.kb.lockPolicy=ALL_OPERATIONS
 */
public final class KbConfigLoader {

    private KbConfigLoader() {}

    public static KbConfig loadDefault() throws IOException {
        Path p = Path.of("kb.yml");
        if (!Files.exists(p)) {
            KbConfig cfg = applySystemOverrides(KbConfig.defaults());
            cfg.validate();
            return cfg;
        }
        return load(p);
    }

    public static KbConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("kb.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static KbConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        KbConfig cfg = KbConfig.defaults();

        if (root instanceof Map<?, ?> map) {
            // 1) db.*
            Map<String, Object> db = getMap(map, "db");
            if (db != null) {
                setString(db, "path", s -> cfg.setDbPath(Path.of(s)));
                setInt(db, "poolSize", cfg::setPoolSize);
                setInt(db, "busyTimeoutMs", cfg::setBusyTimeoutMs);
            }

            // 2) tables.*
            Map<String, Object> tables = getMap(map, "tables");
            if (tables != null) {
                setString(tables, "prefix", cfg::setTablePrefix);
                setInt(tables, "suffixLength", cfg::setTableSuffixLength);
                setString(tables, "urlSetPrefix", cfg::setUrlSetPrefix);
                setString(tables, "requestSetPrefix", cfg::setRequestSetPrefix);
            }

            // 3) lockPolicy
            setEnum(map, "lockPolicy", LockPolicy.class, cfg::setLockPolicy);
        }

        applySystemOverrides(cfg);
        cfg.validate();
        return cfg;
    }

    /** SysProp(-Dwk.kb.*) 우선 */
    static KbConfig applySystemOverrides(KbConfig cfg) {
        String path = System.getProperty("wk.kb.dbPath");
        if (path != null && !path.isBlank()) cfg.setDbPath(Path.of(path.trim()));

        String pool = System.getProperty("wk.kb.poolSize");
        if (pool != null && !pool.isBlank()) cfg.setPoolSize(Integer.parseInt(pool.trim()));

        String lock = System.getProperty("wk.kb.lockPolicy");
        if (lock != null && !lock.isBlank()) {
            cfg.setLockPolicy(LockPolicy.valueOf(lock.trim().toUpperCase(Locale.ROOT)));
        }
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("Unknown " + key + ": " + s);
    }
}
