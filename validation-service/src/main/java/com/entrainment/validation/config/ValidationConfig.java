package com.entrainment.validation.config;

import com.entrainment.common.graph.ConsciousnessStateGraph;
import com.entrainment.common.profile.CompatibilityScorer;
import com.entrainment.common.profile.ProfileCodec;
import com.entrainment.common.profile.WeightedCompatibilityScorer;
import com.entrainment.common.validation.PresetValidator;
import com.entrainment.common.validation.ValidationOrchestrator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ValidationConfig {

    @Value("${validation.strict-mode:false}")
    private boolean strictMode;

    @Bean
    public ConsciousnessStateGraph consciousnessStateGraph() {
        return ConsciousnessStateGraph.defaultGraph();
    }

    @Bean
    public ValidationOrchestrator validationOrchestrator(ConsciousnessStateGraph graph) {
        return new ValidationOrchestrator(graph, strictMode);
    }

    @Bean
    public PresetValidator presetValidator(ValidationOrchestrator orchestrator) {
        return new PresetValidator(orchestrator);
    }

    @Bean
    public CompatibilityScorer compatibilityScorer() {
        return new WeightedCompatibilityScorer();
    }

    @Bean
    public ProfileCodec profileCodec(ObjectMapper objectMapper) {
        return new ProfileCodec(objectMapper);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
