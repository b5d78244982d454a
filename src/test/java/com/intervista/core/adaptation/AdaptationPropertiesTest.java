package com.intervista.core.adaptation;

import com.intervista.core.config.InvalidConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AdaptationPropertiesTest {

    private AdaptationProperties properties;
    private AdaptationProperties.RuleSpec rule;

    @BeforeEach
    void setUp() {
        properties = new AdaptationProperties();
        var parameters = new LinkedHashMap<String, AdaptationProperties.ParameterSpec>();
        parameters.put("speech.threshold", new AdaptationProperties.ParameterSpec(0.5, 0.9, 0.7));
        properties.setParameters(parameters);

        rule = new AdaptationProperties.RuleSpec();
        rule.setName("lower-speech-threshold");
        rule.setMetric("speech.confidence");
        rule.setParameter("speech.threshold");
        rule.setDelta(-0.05);
        properties.setRules(new ArrayList<>(List.of(rule)));
    }

    @Test
    void acceptsAValidConfiguration() {
        assertDoesNotThrow(properties::validate);
    }

    @Test
    void rejectsInitialValueOutsideBounds() {
        properties.getParameters().put("visual.frame_rate", new AdaptationProperties.ParameterSpec(1, 10, 12));
        var ex = assertThrows(InvalidConfigurationException.class, properties::validate);
        assertTrue(ex.getMessage().contains("visual.frame_rate"));
    }

    @Test
    void rejectsRuleOnUnknownParameter() {
        rule.setParameter("speech.volume");
        assertThrows(InvalidConfigurationException.class, properties::validate);
    }

    @Test
    void rejectsUnknownMetric() {
        rule.setMetric("speech.loudness");
        assertThrows(InvalidConfigurationException.class, properties::validate);
    }

    @Test
    void acceptsSessionLevelMetrics() {
        rule.setMetric("degraded_ratio");
        assertDoesNotThrow(properties::validate);
    }

    @Test
    void rejectsNonPositiveSizes() {
        properties.setWindowSize(0);
        assertThrows(InvalidConfigurationException.class, properties::validate);
    }
}
