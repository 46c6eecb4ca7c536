package com.taskforest.core.engine;

import com.taskforest.core.extract.SubInstructionExtractor;
import com.taskforest.core.index.InstructionNormalizer;
import com.taskforest.core.matching.SimilarityScorer;
import com.taskforest.core.validation.RelationValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HierarchyConfig {

    @Bean
    public SubInstructionExtractor subInstructionExtractor(HierarchyProperties properties) {
        return new SubInstructionExtractor(properties.getMinInstructionLength());
    }

    @Bean
    public InstructionNormalizer instructionNormalizer(HierarchyProperties properties) {
        return new InstructionNormalizer(properties.getMaxPrefixLength());
    }

    @Bean
    public SimilarityScorer similarityScorer(HierarchyProperties properties) {
        return new SimilarityScorer(properties.getWeights().toScoringWeights());
    }

    @Bean
    public RelationValidator relationValidator() {
        return new RelationValidator();
    }

    // Without an actuator on the classpath nothing else provides a registry.
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
