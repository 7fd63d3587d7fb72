package com.flowscribe.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("flowscribe.yaml");
        Files.writeString(configFile, """
            classifier:
              decisiveMargin: 3
              strongScore: 6
              flowchartOverrideMinScore: 1
              flowchartOverrideMaxGap: 2

            traversal:
              maxRevisits: 5

            templates:
              enabled: false
              path: "./my-templates.json"

            output:
              directory: "./build/flows"
              prettyPrint: false
            """);

        FlowScribeConfig config = ConfigLoader.load(configFile);

        assertThat(config.classifier().decisiveMargin()).isEqualTo(3);
        assertThat(config.classifier().strongScore()).isEqualTo(6);
        assertThat(config.classifier().flowchartOverrideMinScore()).isEqualTo(1);
        assertThat(config.classifier().flowchartOverrideMaxGap()).isEqualTo(2);
        assertThat(config.traversal().maxRevisits()).isEqualTo(5);
        assertThat(config.templates().enabled()).isFalse();
        assertThat(config.templates().path()).isEqualTo("./my-templates.json");
        assertThat(config.output().directory()).isEqualTo("./build/flows");
        assertThat(config.output().prettyPrint()).isFalse();
    }

    @Test
    void load_partialYaml_fillsMissingValuesWithDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowscribe.yaml");
        Files.writeString(configFile, """
            classifier:
              strongScore: 8
            """);

        FlowScribeConfig config = ConfigLoader.load(configFile);

        assertThat(config.classifier().strongScore()).isEqualTo(8);
        assertThat(config.classifier().decisiveMargin()).isEqualTo(2);
        assertThat(config.traversal().maxRevisits()).isEqualTo(3);
        assertThat(config.templates().enabled()).isTrue();
        assertThat(config.templates().path()).isNull();
        assertThat(config.output().directory()).isEqualTo("./flows");
        assertThat(config.output().prettyPrint()).isTrue();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("flowscribe.yaml");
        Files.writeString(configFile, """
            project:
              name: "ignored"
            traversal:
              maxRevisits: 2
              strategy: bfs
            """);

        FlowScribeConfig config = ConfigLoader.load(configFile);

        assertThat(config.traversal().maxRevisits()).isEqualTo(2);
    }

    @Test
    void load_nonExistentFile_returnsDefaults() {
        FlowScribeConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(FlowScribeConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowscribe.yaml");
        Files.writeString(configFile, """
            classifier:
              decisiveMargin: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(FlowScribeConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("flowscribe.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(FlowScribeConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(FlowScribeConfig.defaults());
    }
}
