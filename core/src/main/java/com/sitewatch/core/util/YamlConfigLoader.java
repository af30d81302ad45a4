package com.sitewatch.core.util;

import com.sitewatch.core.model.RunConfig;
import com.sitewatch.core.model.RunConfig.HeaderRule;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * sitewatch.yml 을 읽어 RunConfig 로 변환. 없는 키는 기본값 유지, 모르는 키는 무시.
 *
 * 예상 YAML 키:
 * targetsFile: "website_list.txt"
 * run:
 *   workers: 50
 *   maxRetries: 1
 *   timeoutMs: 5000
 *   followRedirects: true
 *   intervalSeconds: 30
 * validation:
 *   httpsRequired: true
 *   headers:
 *     required: ["Content-Type"]
 *     contentTypeAllow: ["text/html", "application/json"]
 *     equals:
 *       X-Frame-Options: "DENY"
 *     contains:
 *       Cache-Control: "max-age="
 *   body:
 *     maxBytes: 65536
 *     containsAll: ["Welcome"]
 *     containsAny: ["Login", "Sign in"]
 * output:
 *   dir: "out"
 *   json: false
 * timeSource:
 *   url: "https://timeapi.io/api/Time/current/zone?timeZone=UTC"
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "sitewatch.yml";

    private YamlConfigLoader() {}

    public static RunConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static RunConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            return fromTree(yaml.load(in));
        }
    }

    /** 이미 파싱된 YAML 트리 → RunConfig. 비어있거나 스칼라면 defaults. */
    static RunConfig fromTree(Object root) {
        RunConfig.Builder b = RunConfig.builder();
        if (!(root instanceof Map<?, ?> map)) {
            return b.build();
        }

        // 1) 평면 키
        setString(map, "targetsFile", s -> b.targetsFile(Path.of(s)));

        // 2) run.*
        Map<String, Object> run = getMap(map, "run");
        if (run != null) {
            setInt(run, "workers", b::workerCount);
            setInt(run, "maxRetries", b::maxRetries);
            setLong(run, "timeoutMs", b::requestTimeoutMs);
            setBoolean(run, "followRedirects", b::followRedirects);
            setLong(run, "intervalSeconds", sec -> b.interval(Duration.ofSeconds(Math.max(0, sec))));
        }

        // 3) validation.*
        Map<String, Object> validation = getMap(map, "validation");
        if (validation != null) {
            setBoolean(validation, "httpsRequired", b::httpsRequired);

            Map<String, Object> headers = getMap(validation, "headers");
            if (headers != null) {
                setStringList(headers, "required", b::requiredHeaders);
                setStringList(headers, "contentTypeAllow", b::contentTypeAllowlist);
                setRules(headers, "equals", b::headerEquals);
                setRules(headers, "contains", b::headerContains);
            }

            Map<String, Object> body = getMap(validation, "body");
            if (body != null) {
                setInt(body, "maxBytes", b::maxBodyBytes);
                setStringList(body, "containsAll", b::bodyContainsAll);
                setStringList(body, "containsAny", b::bodyContainsAny);
            }
        }

        // 4) output.*
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> b.outputDir(Path.of(s)));
            setBoolean(output, "json", b::jsonOutput);
        }

        // 5) timeSource.url
        Map<String, Object> ts = getMap(map, "timeSource");
        if (ts != null) {
            setString(ts, "url", s -> b.timeSourceUrl(URI.create(s.trim())));
        }

        // 기본값/필수값 확인
        return b.build();
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

    /** 리스트 또는 "a,b,c" 문자열. 빈 리스트는 규칙 해제로 본다. */
    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        if (!map.containsKey(key)) return;
        Object v = map.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else if (v != null) {
            String s = String.valueOf(v).trim();
            if (!s.isEmpty()) {
                for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
            }
        }
        setter.accept(List.copyOf(out));
    }

    /** `이름: 값` 맵(순서 유지) 또는 [{name:..., value:...}] 리스트 */
    private static void setRules(Map<?, ?> map, String key, Consumer<List<HeaderRule>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<HeaderRule> out = new ArrayList<>();
        if (v instanceof Map<?, ?> m) {
            for (var e : m.entrySet()) {
                if (e.getKey() != null && e.getValue() != null) {
                    out.add(new HeaderRule(String.valueOf(e.getKey()), String.valueOf(e.getValue())));
                }
            }
        } else if (v instanceof List<?> list) {
            for (Object o : list) {
                if (o instanceof Map<?, ?> item && item.get("name") != null && item.get("value") != null) {
                    out.add(new HeaderRule(String.valueOf(item.get("name")), String.valueOf(item.get("value"))));
                }
            }
        } else {
            throw new IllegalArgumentException(key + " must be a map of header: value");
        }
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean bool) setter.accept(bool);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, v));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept((long) parseInt(key, v));
    }

    private static int parseInt(String key, Object v) {
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        }
    }
}
