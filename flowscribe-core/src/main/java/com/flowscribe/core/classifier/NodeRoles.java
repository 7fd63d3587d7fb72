package com.flowscribe.core.classifier;

import com.flowscribe.core.model.DiagramType;

import java.util.Set;

/**
 * Role names assigned by the {@link RoleClassifier}, grouped by diagram type.
 */
public final class NodeRoles {

    // Flowchart
    public static final String START = "Start";
    public static final String END = "End";
    public static final String DECISION = "Decision";
    public static final String LOOP = "Loop";
    public static final String INPUT = "Input";
    public static final String OUTPUT = "Output";
    public static final String PROCESS = "Process";
    public static final String JUMP = "Jump";

    // UML class diagram
    public static final String INTERFACE = "Interface";
    public static final String CLASS = "Class";
    public static final String METHOD = "Method";
    public static final String ATTRIBUTE = "Attribute";
    public static final String UNKNOWN_UML_PART = "Unknown UML Part";

    // UML sequence diagram
    public static final String LIFELINE = "Lifeline";
    public static final String MESSAGE = "Message";
    public static final String ACTOR = "Actor";

    // ER diagram (also uses ATTRIBUTE)
    public static final String ENTITY = "Entity";
    public static final String RELATIONSHIP = "Relationship";

    // UML activity diagram
    public static final String FORK = "Fork";
    public static final String JOIN = "Join";
    public static final String ACTION = "Action";
    public static final String SWIMLANE = "Swimlane";

    /** Sentinel for nodes no rule could place */
    public static final String UNKNOWN = "Unknown";

    private NodeRoles() {
        // Constants class
    }

    /**
     * Returns every role a node of the given diagram type can receive, sentinels included.
     *
     * @param type diagram type
     * @return legal role names
     */
    public static Set<String> vocabularyFor(DiagramType type) {
        return switch (type) {
            case FLOWCHART -> Set.of(START, END, DECISION, LOOP, INPUT, OUTPUT, PROCESS, JUMP, UNKNOWN);
            case UML_CLASS -> Set.of(INTERFACE, CLASS, METHOD, ATTRIBUTE, UNKNOWN_UML_PART, UNKNOWN);
            case UML_SEQUENCE -> Set.of(LIFELINE, MESSAGE, ACTOR, UNKNOWN);
            case ER -> Set.of(ENTITY, ATTRIBUTE, RELATIONSHIP, UNKNOWN);
            case UML_ACTIVITY -> Set.of(FORK, JOIN, ACTION, SWIMLANE, UNKNOWN);
            case UNKNOWN -> Set.of(UNKNOWN);
        };
    }
}
