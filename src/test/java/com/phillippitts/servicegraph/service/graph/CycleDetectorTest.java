package com.phillippitts.servicegraph.service.graph;

import com.phillippitts.servicegraph.domain.CyclePath;
import com.phillippitts.servicegraph.domain.DependencyEdge;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CycleDetectorTest {

    private final CycleDetector detector = new CycleDetector();

    @Test
    void shouldFindThreeNodeCycleInVisitationOrder() {
        DependencyGraph graph = DependencyGraph.of(List.of("A", "B", "C"), List.of(
                DependencyEdge.hard("A", "B"),
                DependencyEdge.hard("B", "C"),
                DependencyEdge.hard("C", "A")));

        Optional<CyclePath> cycle = detector.detectCycle(graph);

        assertThat(cycle).isPresent();
        assertThat(cycle.get().services()).containsExactly("A", "B", "C");
        assertThat(cycle.get().describe()).isEqualTo("A → B → C → A");
    }

    @Test
    void cyclePathStartsAtFirstOccurrenceOfRevisitedNode() {
        DependencyGraph graph = DependencyGraph.of(List.of("root", "X", "Y"), List.of(
                DependencyEdge.hard("root", "X"),
                DependencyEdge.hard("X", "Y"),
                DependencyEdge.hard("Y", "X")));

        assertThat(detector.detectCycle(graph)).get()
                .extracting(CyclePath::services)
                .isEqualTo(List.of("X", "Y"));
    }

    @Test
    void shouldReturnEmptyForDiamond() {
        DependencyGraph graph = DependencyGraph.of(List.of("A", "B", "C", "D"), List.of(
                DependencyEdge.hard("A", "B"),
                DependencyEdge.hard("A", "C"),
                DependencyEdge.hard("B", "D"),
                DependencyEdge.hard("C", "D")));

        assertThat(detector.detectCycle(graph)).isEmpty();
    }

    @Test
    void softEdgesNeverFormCycles() {
        DependencyGraph graph = DependencyGraph.of(List.of("A", "B"), List.of(
                DependencyEdge.hard("A", "B"),
                DependencyEdge.soft("B", "A")));

        assertThat(detector.detectCycle(graph)).isEmpty();
    }

    @Test
    void emptyGraphHasNoCycle() {
        assertThat(detector.detectCycle(DependencyGraph.of(List.of(), List.of()))).isEmpty();
    }
}
