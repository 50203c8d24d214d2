package com.di.qualityguard.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for AnalysisProperties binding defaults and validation.
 */
@DisplayName("AnalysisProperties Tests")
class AnalysisPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    @DisplayName("Defaults should match AnalysisConfig defaults")
    void testDefaults() {
        assertEquals(AnalysisConfig.defaults(), new AnalysisProperties().toAnalysisConfig());
    }

    @Test
    @DisplayName("Should carry overridden values into the frozen config")
    void testOverrides() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.setPsiBins(20);
        properties.setCriticalPenalty(25);

        AnalysisConfig config = properties.toAnalysisConfig();
        assertEquals(20, config.getPsiBins());
        assertEquals(25, config.getCriticalPenalty());
    }

    @Test
    @DisplayName("Should resolve worker threads to the processor count when 0")
    void testEffectiveWorkerThreads() {
        AnalysisProperties properties = new AnalysisProperties();
        assertEquals(Runtime.getRuntime().availableProcessors(), properties.getEffectiveWorkerThreads());
        properties.setWorkerThreads(3);
        assertEquals(3, properties.getEffectiveWorkerThreads());
    }

    @Test
    @DisplayName("Defaults should pass validation")
    void testValidation_Defaults() {
        assertTrue(validator.validate(new AnalysisProperties()).isEmpty());
    }

    @Test
    @DisplayName("Should reject out-of-range thresholds")
    void testValidation_OutOfRange() {
        AnalysisProperties properties = new AnalysisProperties();
        properties.setCategoricalMaxFraction(1.5);
        properties.setPsiBins(0);
        properties.setRequestTimeout(null);

        Set<ConstraintViolation<AnalysisProperties>> violations = validator.validate(properties);
        assertEquals(3, violations.size());
    }
}
