package com.webdelta.core.util;

import com.webdelta.core.model.CompareConfig;
import com.webdelta.core.model.FieldSchema;
import com.webdelta.core.model.RendererKind;
import com.webdelta.core.model.UrlMatching;
import com.webdelta.core.model.WaitStrategy;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * compare.yml을 읽어 CompareConfig로 변환.
 *
 * 예상 YAML 키:
 * oldDomain: "https://old.example.com"
 * newDomain: "https://new.example.com"
 * maxPages: 50              # 생략 시 무제한
 * quick: false
 * schema: FULL | REDUCED
 * renderer: jsoup | playwright
 * urlMatching: exact | normalized
 * concurrentCrawls: false
 * output:
 *   dir: "out"
 *   formats: ["json", "md", "snapshots"]
 * render:
 *   viewportWidth: 1920
 *   viewportHeight: 1080
 *   userAgent: "..."
 *   waitStrategy: networkidle
 *   timeoutMs: 30000
 *   headless: true
 *
 * 필수값(oldDomain/newDomain) 검사는 CLI 덮어쓰기 이후 호출자가 validate()로 한다.
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "compare.yml";

    private YamlConfigLoader() {}

    public static CompareConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static CompareConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    public static CompareConfig fromStream(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CompareConfig cfg = CompareConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        // 1) 평면 키
        setString(map, "oldDomain", cfg::setOldDomain);
        setString(map, "newDomain", cfg::setNewDomain);
        setInt(map, "maxPages", cfg::setMaxPages);
        setBoolean(map, "quick", cfg::setQuick);
        setEnum(map, "schema", FieldSchema.class, cfg::setSchema);
        setEnum(map, "renderer", RendererKind.class, cfg::setRenderer);
        setEnum(map, "urlMatching", UrlMatching.class, cfg::setUrlMatching);
        setBoolean(map, "concurrentCrawls", cfg::setConcurrentCrawls);

        // 2) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setPath(output, "dir", cfg::setOutputDir);
            setStringList(output, "formats", cfg::setFormats);
        }

        // 3) render.*
        Map<String, Object> render = getMap(map, "render");
        if (render != null) {
            var r = cfg.getRender();
            setInt(render, "viewportWidth", r::setViewportWidth);
            setInt(render, "viewportHeight", r::setViewportHeight);
            setString(render, "userAgent", r::setUserAgent);
            setEnum(render, "waitStrategy", WaitStrategy.class, r::setWaitStrategy);
            setInt(render, "timeoutMs", r::setTimeoutMs);
            setBoolean(render, "headless", r::setHeadless);
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

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "json,md" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(v instanceof Number n ? n.intValue() : Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }

    /** 대소문자 무시. 알 수 없는 값은 IllegalArgumentException */
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
        throw new IllegalArgumentException("unknown " + key + ": " + s
                + " (expected one of " + Arrays.toString(type.getEnumConstants()) + ")");
    }
}
