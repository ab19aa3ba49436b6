package com.qaradar.core.util;

import com.qaradar.core.model.DiscoveryConfig;
import com.qaradar.core.model.InvalidConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlConfigLoaderTest {

    @TempDir Path tmp;

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void reads_flat_keys_and_sections() throws IOException {
        Path f = tmp.resolve("discovery.yml");
        Files.writeString(f, String.join("\n",
                "target: \"shop.example.com\"",
                "strictMode: true",
                "timeoutMs: 2500",
                "concurrency: 2",
                "rps: 3",
                "followRedirects: false",
                "userAgent: \"Tester/1.0\"",
                "runTimeBudgetMs: 15000",
                "scope:",
                "  maxPages: 6",
                "  skipStaticAssets: false",
                "  excludePaths: [\"/account\", \"re:/tag/\\\\d+$\"]",
                "output:",
                "  dir: \"build/briefs\""));

        DiscoveryConfig c = YamlConfigLoader.load(f);

        assertThat(c.getTarget()).isEqualTo("shop.example.com");
        assertThat(c.isStrictMode()).isTrue();
        assertThat(c.getTimeoutMs()).isEqualTo(2500);
        assertThat(c.getConcurrency()).isEqualTo(2);
        assertThat(c.getRps()).isEqualTo(3);
        assertThat(c.isFollowRedirects()).isFalse();
        assertThat(c.getUserAgent()).isEqualTo("Tester/1.0");
        assertThat(c.getRunTimeBudgetMs()).isEqualTo(15000);
        assertThat(c.getMaxPages()).isEqualTo(6);
        assertThat(c.isSkipStaticAssets()).isFalse();
        assertThat(c.getExcludePaths()).containsExactly("/account", "re:/tag/\\d+$");
        assertThat(c.getOutputDir()).isEqualTo(Path.of("build/briefs"));
    }

    @Test
    void empty_document_keeps_defaults() {
        DiscoveryConfig c = YamlConfigLoader.load(yaml(""));
        assertThat(c.getTarget()).isNull();
        assertThat(c.getMaxPages()).isEqualTo(DiscoveryConfig.DEFAULT_MAX_PAGES);
    }

    @Test
    void comma_separated_exclude_paths() {
        DiscoveryConfig c = YamlConfigLoader.load(yaml("scope:\n  excludePaths: \"/a, /b\"\n"));
        assertThat(c.getExcludePaths()).containsExactly("/a", "/b");
    }

    @Test
    void non_numeric_value_is_configuration_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("scope:\n  maxPages: lots\n")))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void malformed_yaml_is_configuration_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("target: [unclosed\n")))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void loader_does_not_validate() {
        DiscoveryConfig c = YamlConfigLoader.load(yaml("maxPages: 0\n"));
        assertThat(c.getMaxPages()).isZero();
    }

    @Test
    void missing_file_is_io_error() {
        assertThatThrownBy(() -> YamlConfigLoader.load(tmp.resolve("nope.yml"))).isInstanceOf(IOException.class);
    }
}
