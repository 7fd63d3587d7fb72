package com.flowscribe.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Control-flow category of an execution step, derived from the node role.
 */
public enum FlowType {
    START,
    END,
    DECISION,
    LOOP,
    INPUT,
    OUTPUT,
    PROCESS,
    TASK,
    JUMP,
    /** Any class-diagram element: class, interface, method or attribute */
    UML_ELEMENT,
    /** Role with no control-flow meaning */
    GENERIC_ACTION;

    /**
     * Returns the serialized tag, e.g. {@code "uml_element"}.
     *
     * @return lowercase tag
     */
    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a role name to its flow type.
     *
     * @param role role name, compared case-insensitively
     * @return flow type, {@link #GENERIC_ACTION} when the role has no dedicated category
     */
    public static FlowType forRole(String role) {
        String normalized = role == null ? "" : role.toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "start" -> START;
            case "end" -> END;
            case "decision" -> DECISION;
            case "loop" -> LOOP;
            case "input" -> INPUT;
            case "output" -> OUTPUT;
            case "process" -> PROCESS;
            case "task" -> TASK;
            case "jump" -> JUMP;
            case "class", "interface", "method", "attribute" -> UML_ELEMENT;
            default -> GENERIC_ACTION;
        };
    }

    @Override
    public String toString() {
        return tag();
    }
}
