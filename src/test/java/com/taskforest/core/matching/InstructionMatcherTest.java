package com.taskforest.core.matching;

import com.taskforest.core.index.InstructionIndex;
import com.taskforest.core.model.MatchCandidate;
import com.taskforest.core.model.TaskSkeleton;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InstructionMatcherTest {

    private InstructionIndex index;
    private InstructionMatcher matcher;

    @BeforeEach
    void setUp() {
        index = new InstructionIndex();
        matcher = new InstructionMatcher(index);
    }

    private static TaskSkeleton task(String id, String workspace, String createdAt, String instruction) {
        return TaskSkeleton.of(id, workspace, createdAt, null, instruction, List.of());
    }

    @Test
    @DisplayName("ranks the declaring parent first with a score over the threshold")
    void ranksDeclaringParent() {
        index.add("P", "build module X");
        index.add("P", "write tests for X");

        List<MatchCandidate> first = matcher.findBestMatches("build module X please");
        assertEquals(1, first.size());
        assertEquals("P", first.get(0).ownerTaskId());
        assertTrue(first.get(0).score() >= 0.7);
        assertEquals("build module x", first.get(0).matchedPrefix());
        assertTrue(first.get(0).matchedTerms().contains("module"));

        List<MatchCandidate> second = matcher.findBestMatches("write tests for X now");
        assertEquals("P", second.get(0).ownerTaskId());
        assertTrue(second.get(0).score() >= 0.7);
    }

    @Test
    @DisplayName("drops candidates under the threshold")
    void dropsUnderThreshold() {
        index.add("P", "build module X");
        assertTrue(matcher.findBestMatches("build module X please", 0.99).isEmpty());
        assertTrue(matcher.findBestMatches("deploy to production").isEmpty());
    }

    @Test
    @DisplayName("keeps only the best score per owner")
    void bestPerOwner() {
        index.add("P", "build module");
        index.add("P", "build module x");
        List<MatchCandidate> result = matcher.findBestMatches("build module x");
        assertEquals(1, result.size());
        assertEquals(1.0, result.get(0).score(), 1e-9);
    }

    @Test
    @DisplayName("never matches a task to itself")
    void excludesSelf() {
        index.add("C1", "build module x");
        index.add("P", "build module x");
        var child = task("C1", "/w", "2025-03-01T10:05:00Z", "build module x please");

        List<MatchCandidate> result = matcher.findBestMatches(child, Map.of("C1", child));
        assertEquals(List.of("P"), result.stream().map(MatchCandidate::ownerTaskId).toList());
    }

    @Test
    @DisplayName("ties prefer the same workspace, then the closest earlier creation time")
    void tieBreak() {
        var early = task("P-early", "/w", "2025-03-01T09:00:00Z", "plan");
        var recent = task("P-recent", "/w", "2025-03-01T10:00:00Z", "plan");
        var future = task("P-future", "/w", "2025-03-01T12:00:00Z", "plan");
        var foreign = task("P-foreign", "/other", "2025-03-01T10:59:00Z", "plan");
        var child = task("C", "/w", "2025-03-01T11:00:00Z", "build module x please");
        for (TaskSkeleton p : List.of(foreign, future, early, recent)) {
            index.add(p.taskId(), "build module x");
        }
        Map<String, TaskSkeleton> owners = Map.of(
                early.taskId(), early, recent.taskId(), recent, future.taskId(), future,
                foreign.taskId(), foreign, child.taskId(), child);

        List<String> ranked = matcher.findBestMatches(child, owners).stream()
                .map(MatchCandidate::ownerTaskId).toList();
        assertEquals(List.of("P-recent", "P-early", "P-future", "P-foreign"), ranked);
    }

    @Test
    @DisplayName("exact matches accept only a declared prefix, at full confidence")
    void exactMatches() {
        index.add("P", "build module X please");
        index.add("Q", "build module X");
        index.add("C", "build module X please");
        var child = task("C", "/w", null, "Build module X please");
        var near = task("D", "/w", null, "build module X soon");

        List<MatchCandidate> result = matcher.findExactMatches(child, Map.of("C", child));
        assertEquals(List.of("P"), result.stream().map(MatchCandidate::ownerTaskId).toList());
        assertEquals(1.0, result.get(0).score());
        assertEquals("build module x please", result.get(0).matchedPrefix());
        assertTrue(matcher.findExactMatches(near, Map.of()).isEmpty());
    }

    @Test
    @DisplayName("a child without an instruction gets no candidates")
    void noInstruction() {
        index.add("P", "build module x");
        var child = task("C", "/w", null, null);
        assertTrue(matcher.findBestMatches(child, Map.of()).isEmpty());
    }
}
