package com.taskforest;

import com.taskforest.core.engine.HierarchyProperties;
import com.taskforest.core.engine.HierarchyReconstructionEngine;
import com.taskforest.core.model.ReconstructionResult;
import com.taskforest.core.model.TaskSkeleton;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "taskforest.hierarchy.match-threshold=0.75")
class TaskForestApplicationTest {

    @Autowired
    private HierarchyReconstructionEngine engine;

    @Autowired
    private HierarchyProperties properties;

    @Autowired
    private MeterRegistry registry;

    @Test
    @DisplayName("binds configuration and wires the engine")
    void contextWiresEngine() {
        assertEquals(0.75, properties.getMatchThreshold());
        assertEquals(192, properties.getMaxPrefixLength());
        assertEquals(0.3, properties.getWeights().getCommonWords());

        ReconstructionResult result = engine.reconstruct(List.of(
                TaskSkeleton.of("P", "/w", "2025-03-01T10:00:00Z", null, "plan", List.of("build module X")),
                TaskSkeleton.of("C", "/w", "2025-03-01T10:05:00Z", null, "build module X please", List.of())));

        assertEquals("P", result.find("C").orElseThrow().parentTaskId());
        assertNotNull(registry.find("taskforest.pass.duration").timer());
    }
}
