package com.flowscribe.core.classifier.rules;

import com.flowscribe.core.model.GraphNode;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FlowchartRoleRules}.
 */
class FlowchartRoleRulesTest {

    private final FlowchartRoleRules rules = new FlowchartRoleRules();

    @ParameterizedTest(name = "[{index}] \"{0}\" / {1} -> {2}")
    @CsvSource({
        "Start,            ellipse,          Start",
        "Begin,            terminator,       Start",
        "Restart process,  rectangle,        Start",
        "End,              ellipse,          End",
        "Stop,             terminator,       End",
        "x > 0?,           rectangle,        Decision",
        "'',               diamond,          Decision",
        "Check stock,      rectangle,        Decision",
        "Repeat,           rectangle,        Loop",
        "Read number,      rectangle,        Input",
        "Value,            parallelogram,    Input",
        "Print result,     parallelogram,    Output",
        "Total,            display,          Output",
        "Compute total,    rectangle,        Process",
        "Go to A,          offpageconnector, Jump",
        "Compute,          '',               Process"
    })
    void roleOf_cascade_resolvesExpectedRole(String label, String shape, String expectedRole) {
        assertThat(rules.roleOf(GraphNode.of("n", label, shape))).isEqualTo(expectedRole);
    }

    @ParameterizedTest
    @CsvSource({
        "'  START  ', Start",
        "'  End ',    End"
    })
    void roleOf_paddedMixedCaseLabel_isNormalized(String label, String expectedRole) {
        assertThat(rules.roleOf(GraphNode.of("n", label, ""))).isEqualTo(expectedRole);
    }
}
