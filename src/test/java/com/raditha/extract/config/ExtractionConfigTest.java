package com.raditha.extract.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionConfigTest {

    @Test
    void testModerateDefaults() {
        ExtractionConfig config = ExtractionConfig.moderate();

        assertEquals(10, config.maxCyclomaticComplexity());
        assertEquals(15, config.maxVariableComplexity());
        assertEquals(5, config.maxExternalVariables());
        assertEquals(3, config.maxModifiedVariables());
        assertEquals(3, config.maxTupleSize());
    }

    @Test
    void testPresetsAreOrdered() {
        ExtractionConfig strict = ExtractionConfig.strict();
        ExtractionConfig lenient = ExtractionConfig.lenient();

        assertTrue(strict.maxCyclomaticComplexity() < lenient.maxCyclomaticComplexity());
        assertTrue(strict.maxExternalVariables() < lenient.maxExternalVariables());
        assertEquals(strict, ExtractionConfig.forPreset("strict"));
        assertEquals(lenient, ExtractionConfig.forPreset("lenient"));
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractionConfig(0, 15, 5, 3, 3));
        assertThrows(IllegalArgumentException.class, () -> new ExtractionConfig(10, 15, 5, 3, 1));
        assertThrows(IllegalArgumentException.class, () -> new ExtractionConfig(10, 15, -1, 3, 3));
        assertThrows(IllegalArgumentException.class, () -> ExtractionConfig.forPreset("unknown"));
    }
}
