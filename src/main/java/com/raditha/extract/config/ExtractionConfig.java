package com.raditha.extract.config;

/**
 * Thresholds for extraction advisories.
 *
 * @param maxCyclomaticComplexity complexity above which HIGH_COMPLEXITY is raised
 * @param maxVariableComplexity   variable complexity score above which HIGH_VARIABLE_COMPLEXITY is raised
 * @param maxExternalVariables    number of incoming variables above which TOO_MANY_DEPENDENCIES is raised
 * @param maxModifiedVariables    number of modified incoming variables above which TOO_MANY_MODIFIED_VARS is raised
 * @param maxTupleSize            most variables that can be returned together as one value
 */
public record ExtractionConfig(
        int maxCyclomaticComplexity,
        int maxVariableComplexity,
        int maxExternalVariables,
        int maxModifiedVariables,
        int maxTupleSize) {

    /**
     * Validate configuration.
     */
    public ExtractionConfig {
        if (maxCyclomaticComplexity < 1) {
            throw new IllegalArgumentException("maxCyclomaticComplexity must be >= 1");
        }
        if (maxVariableComplexity < 1) {
            throw new IllegalArgumentException("maxVariableComplexity must be >= 1");
        }
        if (maxExternalVariables < 0) {
            throw new IllegalArgumentException("maxExternalVariables must be >= 0");
        }
        if (maxModifiedVariables < 0) {
            throw new IllegalArgumentException("maxModifiedVariables must be >= 0");
        }
        if (maxTupleSize < 2) {
            throw new IllegalArgumentException("maxTupleSize must be >= 2");
        }
    }

    /**
     * Moderate preset, the default.
     */
    public static ExtractionConfig moderate() {
        return new ExtractionConfig(
                10, // maxCyclomaticComplexity
                15, // maxVariableComplexity
                5, // maxExternalVariables
                3, // maxModifiedVariables
                3); // maxTupleSize
    }

    /**
     * Strict preset: flags smaller, more entangled selections.
     */
    public static ExtractionConfig strict() {
        return new ExtractionConfig(7, 10, 3, 2, 2);
    }

    /**
     * Lenient preset: only flags selections that are clearly too large.
     */
    public static ExtractionConfig lenient() {
        return new ExtractionConfig(15, 25, 8, 5, 4);
    }

    public static ExtractionConfig forPreset(String preset) {
        return switch (preset) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            case "moderate" -> moderate();
            default -> throw new IllegalArgumentException("Unknown preset: " + preset);
        };
    }
}
