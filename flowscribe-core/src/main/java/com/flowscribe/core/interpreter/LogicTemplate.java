package com.flowscribe.core.interpreter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * One keyword entry of the logic-template table.
 *
 * @param keywords label keywords that select this entry
 * @param logic implementation hint attached to matching steps
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LogicTemplate(
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("logic") String logic
) {
    /**
     * Compact constructor with validation.
     */
    public LogicTemplate {
        Objects.requireNonNull(logic, "logic must not be null");
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
