package com.flowscribe.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of diagrams the classifier can recognize.
 *
 * <p>Every downstream stage is parameterized by the type. Each type also names the template an
 * external code renderer is expected to pick for it.
 */
public enum DiagramType {
    /** Classic flowchart: terminators, decisions, I/O and process boxes */
    FLOWCHART("Flowchart", "flowchart_base.j2"),

    /** UML class diagram */
    UML_CLASS("UML Class Diagram", "uml_class_base.j2"),

    /** UML sequence diagram */
    UML_SEQUENCE("UML Sequence Diagram", "sequence_diagram_base.j2"),

    /** Entity-relationship diagram */
    ER("ER Diagram", "er_diagram_base.j2"),

    /** UML activity diagram (rendered with the flowchart template) */
    UML_ACTIVITY("UML Activity Diagram", "flowchart_base.j2"),

    /** Nothing scored; not an error */
    UNKNOWN("Unknown", "flowchart_base.j2");

    private final String displayName;
    private final String templateName;

    DiagramType(String displayName, String templateName) {
        this.displayName = displayName;
        this.templateName = templateName;
    }

    /**
     * Returns the human-readable name, also used as the serialized value.
     *
     * @return display name such as "UML Class Diagram"
     */
    @JsonValue
    public String displayName() {
        return displayName;
    }

    /**
     * Returns the renderer template associated with this type.
     *
     * @return template file name
     */
    public String templateName() {
        return templateName;
    }

    /**
     * Resolves a type from its display name or enum constant name, case-insensitively.
     *
     * @param name display name or constant name
     * @return matching type, or {@link #UNKNOWN} if nothing matches
     */
    @JsonCreator
    public static DiagramType fromDisplayName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        String trimmed = name.trim();
        for (DiagramType type : values()) {
            if (type.displayName.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
