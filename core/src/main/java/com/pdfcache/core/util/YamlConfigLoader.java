package com.pdfcache.core.util;

import com.pdfcache.core.model.CacheConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * 작업 디렉터리의 pdf-cache.yml 을 읽어 CacheConfig 로 변환.
 *
 * 예상 YAML 키:
 * downloads:
 *   dir: "/var/tmp/pdf-cache/downloads"
 *   timeoutSeconds: 60
 *   maxBytes: 104857600
 *   maxRedirects: 10
 * content:
 *   dir: "/var/tmp/pdf-cache/content"
 *   ttlHours: 24
 * concurrency: 4
 * userAgent: "pdf-cache"
 *
 * 시스템 프로퍼티 -Dpdfcache.content.ttlHours=NN 이 content.ttlHours 보다 우선한다.
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "pdf-cache.yml";
    public static final String TTL_PROPERTY = "pdfcache.content.ttlHours";

    private YamlConfigLoader() {}

    public static CacheConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static CacheConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static CacheConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CacheConfig cfg = CacheConfig.defaults();

        if (root instanceof Map<?, ?> map) {
            // 1) 평면 키
            setInt(map, "concurrency", cfg::setConcurrency);
            setString(map, "userAgent", cfg::setUserAgent);

            // 2) downloads.*
            Map<String, Object> downloads = getMap(map, "downloads");
            if (downloads != null) {
                setPath(downloads, "dir", cfg::setDownloadDir);
                setLong(downloads, "timeoutSeconds", cfg::setTimeoutSeconds);
                setLong(downloads, "maxBytes", cfg::setMaxDownloadBytes);
                setInt(downloads, "maxRedirects", cfg::setMaxRedirects);
            }

            // 3) content.*
            Map<String, Object> content = getMap(map, "content");
            if (content != null) {
                setPath(content, "dir", cfg::setContentDir);
                setLong(content, "ttlHours", cfg::setContentTtlHours);
            }
        }
        // 비어있거나 단순 스칼라면 defaults 유지

        applySystemOverrides(cfg);
        cfg.validate();
        return cfg;
    }

    /** -Dpdfcache.content.ttlHours 우선. 숫자가 아니면 무시 */
    static void applySystemOverrides(CacheConfig cfg) {
        String v = System.getProperty(TTL_PROPERTY);
        if (v == null || v.isBlank()) return;
        try {
            cfg.setContentTtlHours(Long.parseLong(v.trim()));
        } catch (NumberFormatException ignore) {
            // 오타면 파일 값 유지
        }
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

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null && !String.valueOf(v).isBlank()) setter.accept(Path.of(String.valueOf(v)));
    }
}
