package com.example.demo.formulaengine.graph;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.Diagnostic;
import com.example.demo.formulaengine.model.IssueKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Orders formula cells so every cell comes after the cells it reads.
 *
 * Kahn's algorithm runs first, seeded with zero in-degree cells in address order. Cells that
 * never reach in-degree zero belong to, or sit downstream of, a circular reference. They are
 * appended component by component: strongly connected components of the leftover subgraph in
 * topological order of their condensation, ties and members in address order. Each circular
 * reference is reported as a CYCLE_DETECTED diagnostic on every member; scheduling never fails.
 */
@Slf4j
@Component
public class EvaluationScheduler {

    public ScheduleResult schedule(DependencyGraph graph) {
        Map<CellAddress, Integer> inDegree = new HashMap<>();
        List<CellAddress> nodes = new ArrayList<>(new TreeSet<>(graph.getNodes()));
        Deque<CellAddress> queue = new ArrayDeque<>();
        for (CellAddress node : nodes) {
            int degree = graph.inDegree(node);
            inDegree.put(node, degree);
            if (degree == 0) {
                queue.add(node);
            }
        }

        List<CellAddress> order = new ArrayList<>(nodes.size());
        while (!queue.isEmpty()) {
            CellAddress node = queue.poll();
            order.add(node);
            for (CellAddress next : graph.getSuccessors(node)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(next);
                }
            }
        }

        if (order.size() == nodes.size()) {
            return new ScheduleResult(order, Collections.emptySet(), Collections.emptyList(), Collections.emptyList());
        }

        Set<CellAddress> leftover = new LinkedHashSet<>();
        for (CellAddress node : nodes) {
            if (inDegree.get(node) > 0) {
                leftover.add(node);
            }
        }
        List<List<CellAddress>> components = stronglyConnectedComponents(graph, leftover);
        Set<CellAddress> cyclicCells = new LinkedHashSet<>();
        List<List<CellAddress>> cycles = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (List<CellAddress> component : orderComponents(graph, components)) {
            order.addAll(component);
            CellAddress first = component.get(0);
            if (component.size() > 1 || graph.hasEdge(first, first)) {
                cycles.add(component);
                cyclicCells.addAll(component);
                String members = component.stream().map(CellAddress::toString).collect(Collectors.joining(", "));
                log.warn("Circular reference among {}", members);
                for (CellAddress member : component) {
                    diagnostics.add(Diagnostic.of(member, IssueKind.CYCLE_DETECTED,
                            "Circular reference among " + members));
                }
            }
        }
        log.info("Scheduled {} cells, {} circular references covering {} cells",
                order.size(), cycles.size(), cyclicCells.size());
        return new ScheduleResult(order, cyclicCells, cycles, diagnostics);
    }

    /**
     * Iterative Tarjan restricted to the given nodes. Each component is returned sorted.
     */
    private static List<List<CellAddress>> stronglyConnectedComponents(DependencyGraph graph, Set<CellAddress> nodes) {
        Map<CellAddress, Integer> index = new HashMap<>();
        Map<CellAddress, Integer> lowLink = new HashMap<>();
        Set<CellAddress> onStack = new HashSet<>();
        Deque<CellAddress> stack = new ArrayDeque<>();
        List<List<CellAddress>> components = new ArrayList<>();
        int counter = 0;

        for (CellAddress root : nodes) {
            if (index.containsKey(root)) {
                continue;
            }
            Deque<CellAddress> callStack = new ArrayDeque<>();
            Deque<Iterator<CellAddress>> iterators = new ArrayDeque<>();
            index.put(root, counter);
            lowLink.put(root, counter);
            counter++;
            stack.push(root);
            onStack.add(root);
            callStack.push(root);
            iterators.push(graph.getSuccessors(root).iterator());

            while (!callStack.isEmpty()) {
                CellAddress node = callStack.peek();
                Iterator<CellAddress> it = iterators.peek();
                boolean descended = false;
                while (it.hasNext()) {
                    CellAddress next = it.next();
                    if (!nodes.contains(next)) {
                        continue;
                    }
                    if (!index.containsKey(next)) {
                        index.put(next, counter);
                        lowLink.put(next, counter);
                        counter++;
                        stack.push(next);
                        onStack.add(next);
                        callStack.push(next);
                        iterators.push(graph.getSuccessors(next).iterator());
                        descended = true;
                        break;
                    } else if (onStack.contains(next)) {
                        lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                    }
                }
                if (descended) {
                    continue;
                }
                callStack.pop();
                iterators.pop();
                if (!callStack.isEmpty()) {
                    CellAddress parent = callStack.peek();
                    lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(node)));
                }
                if (lowLink.get(node).equals(index.get(node))) {
                    List<CellAddress> component = new ArrayList<>();
                    CellAddress member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(node));
                    Collections.sort(component);
                    components.add(component);
                }
            }
        }
        return components;
    }

    /**
     * Topological order of the condensation; among ready components the one with the smallest
     * first member goes first.
     */
    private static List<List<CellAddress>> orderComponents(DependencyGraph graph, List<List<CellAddress>> components) {
        Map<CellAddress, Integer> componentOf = new HashMap<>();
        for (int i = 0; i < components.size(); i++) {
            for (CellAddress member : components.get(i)) {
                componentOf.put(member, i);
            }
        }
        List<Set<Integer>> edges = new ArrayList<>();
        int[] inDegree = new int[components.size()];
        for (int i = 0; i < components.size(); i++) {
            Set<Integer> targets = new LinkedHashSet<>();
            for (CellAddress member : components.get(i)) {
                for (CellAddress next : graph.getSuccessors(member)) {
                    Integer target = componentOf.get(next);
                    if (target != null && target != i) {
                        targets.add(target);
                    }
                }
            }
            edges.add(targets);
        }
        for (Set<Integer> targets : edges) {
            for (int target : targets) {
                inDegree[target]++;
            }
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>(
                Comparator.comparing((Integer i) -> components.get(i).get(0)));
        for (int i = 0; i < components.size(); i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        List<List<CellAddress>> ordered = new ArrayList<>(components.size());
        while (!ready.isEmpty()) {
            int current = ready.poll();
            ordered.add(components.get(current));
            for (int target : edges.get(current)) {
                if (--inDegree[target] == 0) {
                    ready.add(target);
                }
            }
        }
        return ordered;
    }
}
