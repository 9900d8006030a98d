package fr.lapetina.llm.broker.domain.model;

/**
 * Fixed capability set a model can be routed for.
 */
public enum ModelCapability {
    TEXT_COMPLETION,
    STRUCTURED_OUTPUT,
    STREAMING;

    /**
     * Parses a configuration value such as {@code structured-output}.
     */
    public static ModelCapability fromConfig(String value) {
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
