package com.flowscribe.core.renderer;

import com.flowscribe.core.model.DiagramType;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DocumentOutput} and {@link RenderContext}.
 */
class DocumentOutputTest {

    @Test
    void fileNameFor_replacesExtension() {
        assertThat(DocumentOutput.fileNameFor("login.graphml")).isEqualTo("login.flow.json");
        assertThat(DocumentOutput.fileNameFor("my.login.graphml")).isEqualTo("my.login.flow.json");
    }

    @Test
    void fileNameFor_withoutExtension_appendsSuffix() {
        assertThat(DocumentOutput.fileNameFor("diagram")).isEqualTo("diagram.flow.json");
        assertThat(DocumentOutput.fileNameFor(".hidden")).isEqualTo(".hidden.flow.json");
    }

    @Test
    void relativePathFor_nestedDiagram_keepsParentDirectories() {
        assertThat(DocumentOutput.relativePathFor(Path.of("billing", "v1.2", "login.graphml")))
            .isEqualTo("billing/v1.2/login.flow.json");
    }

    @Test
    void relativePathFor_topLevelDiagram_returnsFileName() {
        assertThat(DocumentOutput.relativePathFor(Path.of("login.graphml"))).isEqualTo("login.flow.json");
    }

    @Test
    void constructor_nullContent_throwsException() {
        assertThatThrownBy(() -> new DocumentOutput("a.flow.json", DiagramType.FLOWCHART, null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("content");
    }

    @Test
    void renderContext_nullSettings_becomeEmpty() {
        RenderContext context = new RenderContext("./out", null);

        assertThat(context.settings()).isEmpty();
        assertThat(context.getSettingOrDefault("console.colors", "true")).isEqualTo("true");
    }

    @Test
    void renderContext_setting_overridesDefault() {
        RenderContext context = new RenderContext(null, Map.of("console.colors", "false"));

        assertThat(context.getSettingOrDefault("console.colors", "true")).isEqualTo("false");
    }
}
