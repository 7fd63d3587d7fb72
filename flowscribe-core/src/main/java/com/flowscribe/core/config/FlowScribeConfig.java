package com.flowscribe.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for FlowScribe.
 *
 * <p>Loaded from {@code flowscribe.yaml}. Every section and field is optional; accessors fall
 * back to the built-in defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * classifier:
 *   decisiveMargin: 2
 *   strongScore: 4
 *   flowchartOverrideMinScore: 2
 *   flowchartOverrideMaxGap: 1
 *
 * traversal:
 *   maxRevisits: 3
 *
 * templates:
 *   enabled: true
 *   path: "./logic_templates.json"
 *
 * output:
 *   directory: "./flows"
 *   prettyPrint: true
 * }</pre>
 *
 * @param classifier diagram classifier thresholds
 * @param traversal traversal settings
 * @param templates logic-template table settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowScribeConfig(
    @JsonProperty("classifier") ClassifierSettings classifier,
    @JsonProperty("traversal") TraversalSettings traversal,
    @JsonProperty("templates") TemplateSettings templates,
    @JsonProperty("output") OutputSettings output
) {
    /**
     * Compact constructor filling absent sections with defaults.
     */
    public FlowScribeConfig {
        if (classifier == null) {
            classifier = ClassifierSettings.defaults();
        }
        if (traversal == null) {
            traversal = TraversalSettings.defaults();
        }
        if (templates == null) {
            templates = TemplateSettings.defaults();
        }
        if (output == null) {
            output = OutputSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static FlowScribeConfig defaults() {
        return new FlowScribeConfig(null, null, null, null);
    }

    /**
     * Diagram classifier thresholds.
     *
     * @param decisiveMargin lead over the runner-up that makes the top type win (default 2)
     * @param strongScore top score that wins regardless of the lead (default 4)
     * @param flowchartOverrideMinScore Flowchart score to exceed before overriding a narrow
     *                                  UML-Class win (default 2)
     * @param flowchartOverrideMaxGap widest UML-Class lead still overridden (default 1)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClassifierSettings(
        @JsonProperty("decisiveMargin") Integer decisiveMargin,
        @JsonProperty("strongScore") Integer strongScore,
        @JsonProperty("flowchartOverrideMinScore") Integer flowchartOverrideMinScore,
        @JsonProperty("flowchartOverrideMaxGap") Integer flowchartOverrideMaxGap
    ) {
        public ClassifierSettings {
            if (decisiveMargin == null) {
                decisiveMargin = 2;
            }
            if (strongScore == null) {
                strongScore = 4;
            }
            if (flowchartOverrideMinScore == null) {
                flowchartOverrideMinScore = 2;
            }
            if (flowchartOverrideMaxGap == null) {
                flowchartOverrideMaxGap = 1;
            }
        }

        public static ClassifierSettings defaults() {
            return new ClassifierSettings(null, null, null, null);
        }
    }

    /**
     * Traversal settings.
     *
     * @param maxRevisits how many times a node may be enqueued during BFS (default 3)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TraversalSettings(
        @JsonProperty("maxRevisits") Integer maxRevisits
    ) {
        public TraversalSettings {
            if (maxRevisits == null) {
                maxRevisits = 3;
            }
        }

        public static TraversalSettings defaults() {
            return new TraversalSettings(null);
        }
    }

    /**
     * Logic-template table settings.
     *
     * @param enabled whether steps are tagged with logic templates (default true)
     * @param path external JSON table; null means the bundled table
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TemplateSettings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("path") String path
    ) {
        public TemplateSettings {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
        }

        public static TemplateSettings defaults() {
            return new TemplateSettings(null, null);
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory for written documents (default "./flows")
     * @param prettyPrint whether JSON is indented (default true)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("prettyPrint") Boolean prettyPrint
    ) {
        public OutputSettings {
            if (directory == null) {
                directory = "./flows";
            }
            if (prettyPrint == null) {
                prettyPrint = Boolean.TRUE;
            }
        }

        public static OutputSettings defaults() {
            return new OutputSettings(null, null);
        }
    }
}
