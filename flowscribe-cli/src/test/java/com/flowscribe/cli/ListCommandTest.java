package com.flowscribe.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void list_loaders_showsGraphMlLoader() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "list", "loaders");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("GraphML Diagram Loader (ID: graphml)");
        assertThat(result.output()).contains("**/*.graphml");
    }

    @Test
    void list_renderers_showsConsoleAndFilesystem() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "list", "renderers");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("console").contains("filesystem");
    }

    @Test
    void list_types_showsTemplates() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "list", "types");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("UML Sequence Diagram").contains("sequence_diagram_base.j2");
    }

    @Test
    void list_unknownType_returnsOne() {
        assertThat(CliTestSupport.run("-q", "list", "widgets").exitCode()).isEqualTo(1);
    }

    @Test
    void list_roles_showsVocabularyPerType() {
        CliTestSupport.Result result = CliTestSupport.run("-q", "list", "roles");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output()).contains("ER Diagram: Attribute, Entity, Relationship, Unknown");
    }
}
