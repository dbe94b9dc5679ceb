package com.example.demo.formulaengine.graph;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.IssueKind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EvaluationScheduler}, including the circular reference fallback.
 */
public class EvaluationSchedulerTest {

    private static final CellAddress A1 = CellAddress.of("S", "A", 1);
    private static final CellAddress A2 = CellAddress.of("S", "A", 2);
    private static final CellAddress A3 = CellAddress.of("S", "A", 3);
    private static final CellAddress B1 = CellAddress.of("S", "B", 1);
    private static final CellAddress C1 = CellAddress.of("S", "C", 1);

    private final EvaluationScheduler scheduler = new EvaluationScheduler();

    private static DependencyGraph graph(CellAddress[] nodes, CellAddress[][] edges) {
        DependencyGraph graph = new DependencyGraph();
        for (CellAddress node : nodes) {
            graph.addNode(node);
        }
        for (CellAddress[] edge : edges) {
            graph.addEdge(edge[0], edge[1]);
        }
        return graph;
    }

    @Test
    public void testChainIsOrderedByDependency() {
        DependencyGraph graph = graph(new CellAddress[]{A3, A1, A2},
                new CellAddress[][]{{A1, A2}, {A2, A3}});

        ScheduleResult result = scheduler.schedule(graph);

        assertEquals(Arrays.asList(A1, A2, A3), result.getOrder());
        assertFalse(result.hasCycles());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    public void testIndependentCellsFollowAddressOrder() {
        DependencyGraph graph = graph(new CellAddress[]{C1, A2, B1, A1}, new CellAddress[0][]);
        assertEquals(Arrays.asList(A1, B1, C1, A2), scheduler.schedule(graph).getOrder());
    }

    /**
     * Test that a two-cell cycle is reported on both members and a reader of the cycle still
     * comes after it.
     */
    @Test
    public void testTwoCellCycle() {
        DependencyGraph graph = graph(new CellAddress[]{A1, B1, C1, A2},
                new CellAddress[][]{{A1, B1}, {B1, A1}, {A1, C1}});

        ScheduleResult result = scheduler.schedule(graph);

        assertEquals(Arrays.asList(A2, A1, B1, C1), result.getOrder());
        assertEquals(List.of(Arrays.asList(A1, B1)), result.getCycles());
        assertTrue(result.getCyclicCells().contains(A1));
        assertFalse(result.getCyclicCells().contains(C1));
        assertEquals(2, result.getDiagnostics().size());
        assertTrue(result.getDiagnostics().stream().allMatch(d -> d.getKind() == IssueKind.CYCLE_DETECTED));
    }

    @Test
    public void testThreeCellCycleIsDeterministic() {
        CellAddress[] nodes = {A3, A2, A1};
        CellAddress[][] edges = {{A1, A2}, {A2, A3}, {A3, A1}};

        ScheduleResult first = scheduler.schedule(graph(nodes, edges));
        ScheduleResult second = scheduler.schedule(graph(nodes, edges));

        assertEquals(Arrays.asList(A1, A2, A3), first.getOrder());
        assertEquals(first.getOrder(), second.getOrder());
        assertEquals(1, first.getCycles().size());
        assertEquals(3, first.getCyclicCells().size());
    }

    @Test
    public void testSelfReference() {
        ScheduleResult result = scheduler.schedule(graph(new CellAddress[]{A1, A2},
                new CellAddress[][]{{A1, A1}, {A1, A2}}));

        assertEquals(Arrays.asList(A1, A2), result.getOrder());
        assertEquals(List.of(List.of(A1)), result.getCycles());
        assertEquals(1, result.getDiagnostics().size());
    }

    @Test
    public void testEveryNodeScheduledOnce() {
        DependencyGraph graph = graph(new CellAddress[]{A1, A2, A3, B1, C1},
                new CellAddress[][]{{A1, A2}, {A2, A1}, {A2, A3}, {B1, C1}, {C1, B1}, {A3, B1}});

        ScheduleResult result = scheduler.schedule(graph);

        assertEquals(5, result.getOrder().size());
        assertEquals(5, result.getOrder().stream().distinct().count());
        assertEquals(2, result.getCycles().size());
        assertTrue(result.getOrder().indexOf(A3) < result.getOrder().indexOf(B1));
    }
}
