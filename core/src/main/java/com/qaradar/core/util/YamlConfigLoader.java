package com.qaradar.core.util;

import com.qaradar.core.model.DiscoveryConfig;
import com.qaradar.core.model.InvalidConfigurationException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * discovery.yml을 읽어 DiscoveryConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "example.com"
 * strictMode: false
 * timeoutMs: 10000
 * concurrency: 4
 * rps: 5
 * followRedirects: true
 * userAgent: "QARadar/2.0 (+discovery)"
 * runTimeBudgetMs: 60000
 * scope:
 *   maxPages: 10
 *   skipStaticAssets: true
 *   excludePaths: ["/account", "re:/tag/\\d+$"]
 * output:
 *   dir: "out"
 *
 * target 없는 파일도 허용한다(CLI 인자로 채움). 검증은 호출자가 validate()로.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static DiscoveryConfig loadDefault() throws IOException {
        return load(Path.of("discovery.yml"));
    }

    public static DiscoveryConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("discovery.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static DiscoveryConfig load(InputStream in) {
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new InvalidConfigurationException("malformed discovery.yml: " + e.getMessage());
        }

        DiscoveryConfig cfg = DiscoveryConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return cfg;
        }

        try {
            // 1) 평면 키
            setString(map, "target", cfg::setTarget);
            setBoolean(map, "strictMode", cfg::setStrictMode);
            setLong(map, "timeoutMs", cfg::setTimeoutMs);
            setInt(map, "concurrency", cfg::setConcurrency);
            setInt(map, "rps", cfg::setRps);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);
            setString(map, "userAgent", cfg::setUserAgent);
            setLong(map, "runTimeBudgetMs", cfg::setRunTimeBudgetMs);
            setInt(map, "maxPages", cfg::setMaxPages); // 평면 키도 허용

            // 2) scope.*
            Map<String, Object> scope = getMap(map, "scope");
            if (scope != null) {
                setInt(scope, "maxPages", cfg::setMaxPages);
                setBoolean(scope, "skipStaticAssets", cfg::setSkipStaticAssets);
                setStringList(scope, "excludePaths", cfg::setExcludePaths);
            }

            // 3) output.dir
            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            }
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("non-numeric value in discovery.yml: " + e.getMessage());
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
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
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
}
