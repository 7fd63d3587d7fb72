package com.flowscribe.core.classifier.rules;

import com.flowscribe.core.classifier.NodeRoles;
import com.flowscribe.core.model.GraphNode;

import java.util.List;
import java.util.Set;

import static com.flowscribe.core.classifier.rules.RoleRules.containsAny;

/**
 * Flowchart cascade: Start, End, Decision, Loop, Input, Output, Process, Jump, then a
 * label-based fallback that defaults to Process.
 *
 * <p>Terminator shapes serve both start and end nodes, and the data shape serves both input
 * and output. A label naming the other role takes precedence over such a shared shape, so an
 * ellipse labelled "End" is an End node and a parallelogram labelled "Print result" is an
 * Output node.
 */
public class FlowchartRoleRules implements RoleRules {

    private static final Set<String> TERMINATOR_SHAPES = Set.of("ellipse", "terminator", "start1");
    private static final Set<String> INPUT_SHAPES = Set.of("parallelogram", "input", "document");
    private static final Set<String> OUTPUT_SHAPES = Set.of("output", "display");
    private static final Set<String> PROCESS_SHAPES = Set.of("rectangle", "roundrectangle", "box");
    private static final Set<String> JUMP_SHAPES = Set.of("offpageconnector", "jump", "connector");

    private static final List<String> END_KEYWORDS = List.of("end", "stop");
    private static final List<String> DECISION_KEYWORDS = List.of("if", "check", "compare", "do", "can", "should", "else");
    private static final List<String> LOOP_KEYWORDS = List.of("repeat", "loop", "again", "while", "for");
    private static final List<String> INPUT_KEYWORDS = List.of("input", "scan", "read", "enter");
    private static final List<String> OUTPUT_KEYWORDS = List.of("print", "display", "output", "show");

    @Override
    public String roleOf(GraphNode node) {
        String label = RoleRules.normalizedLabel(node);
        String shape = RoleRules.normalizedShape(node);

        boolean endLabel = containsAny(label, END_KEYWORDS);
        boolean outputLabel = containsAny(label, OUTPUT_KEYWORDS);

        if (label.contains("start") || (TERMINATOR_SHAPES.contains(shape) && !endLabel)) {
            return NodeRoles.START;
        }
        if (endLabel) {
            return NodeRoles.END;
        }
        if ("diamond".equals(shape) || label.contains("?") || containsAny(label, DECISION_KEYWORDS)) {
            return NodeRoles.DECISION;
        }
        if (containsAny(label, LOOP_KEYWORDS)) {
            return NodeRoles.LOOP;
        }
        if (containsAny(label, INPUT_KEYWORDS) || (INPUT_SHAPES.contains(shape) && !outputLabel)) {
            return NodeRoles.INPUT;
        }
        if (OUTPUT_SHAPES.contains(shape) || outputLabel) {
            return NodeRoles.OUTPUT;
        }
        if (PROCESS_SHAPES.contains(shape)) {
            return NodeRoles.PROCESS;
        }
        if (JUMP_SHAPES.contains(shape)) {
            return NodeRoles.JUMP;
        }
        return fallback(label);
    }

    private String fallback(String label) {
        if (label.contains("print")) {
            return NodeRoles.OUTPUT;
        }
        if (label.contains("input") || label.contains("scan")) {
            return NodeRoles.INPUT;
        }
        return NodeRoles.PROCESS;
    }
}
