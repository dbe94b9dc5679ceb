package com.example.demo.formulaengine.graph;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.EvaluationPlan;
import com.example.demo.formulaengine.model.FormulaGroup;
import com.example.demo.formulaengine.model.PlanItem;
import com.example.demo.formulaengine.model.SingleCellItem;
import com.example.demo.formulaengine.pattern.GroupingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Turns the cell schedule and the grouping into an {@link EvaluationPlan}.
 *
 * A group is evaluated as one block, so it must not be split by another item: groups with a
 * member in a circular reference, groups whose members read each other in both directions, and
 * groups that end up in an item-level cycle are dissolved into single cells. Items are ordered
 * by Kahn's algorithm over the item graph, ready items taken by their earliest position in the
 * cell schedule. Edges inside one circular reference are ignored; those cells keep the
 * scheduler's fallback order.
 */
@Slf4j
@Component
public class EvaluationPlanner {

    /**
     * @param formulas formula text of every formula cell
     */
    public EvaluationPlan plan(GroupingResult grouping, Map<CellAddress, String> formulas,
                               DependencyGraph graph, ScheduleResult schedule) {
        Map<CellAddress, Integer> position = new HashMap<>();
        for (CellAddress cell : schedule.getOrder()) {
            position.put(cell, position.size());
        }
        Map<CellAddress, Integer> cycleOf = new HashMap<>();
        for (int i = 0; i < schedule.getCycles().size(); i++) {
            for (CellAddress member : schedule.getCycles().get(i)) {
                cycleOf.put(member, i);
            }
        }

        List<FormulaGroup> groups = new ArrayList<>();
        List<SingleCellItem> singles = new ArrayList<>(grouping.getSingles());
        for (FormulaGroup group : grouping.getGroups()) {
            FormulaGroup oriented = orient(group, graph, schedule);
            if (oriented == null) {
                log.debug("Evaluating group {}!{} cell by cell", group.getSheet(), group.getRangeLabel());
                dissolve(group, singles, formulas);
            } else {
                groups.add(oriented);
            }
        }

        while (true) {
            List<PlanItem> items = new ArrayList<>(groups);
            items.addAll(singles);
            List<PlanItem> ordered = order(items, graph, position, cycleOf);
            if (ordered.size() == items.size()) {
                log.info("Evaluation plan: {} groups, {} single cells", groups.size(), singles.size());
                return new EvaluationPlan(Collections.unmodifiableList(ordered),
                        Collections.unmodifiableSet(schedule.getCyclicCells()));
            }
            Set<PlanItem> placed = Collections.newSetFromMap(new IdentityHashMap<>());
            placed.addAll(ordered);
            List<FormulaGroup> stuck = new ArrayList<>();
            for (FormulaGroup group : groups) {
                if (!placed.contains(group)) {
                    stuck.add(group);
                }
            }
            if (stuck.isEmpty()) {
                List<PlanItem> rest = new ArrayList<>();
                for (PlanItem item : items) {
                    if (!placed.contains(item)) {
                        rest.add(item);
                    }
                }
                rest.sort(Comparator.comparing(item -> firstPosition(item, position)));
                ordered.addAll(rest);
                return new EvaluationPlan(Collections.unmodifiableList(ordered),
                        Collections.unmodifiableSet(schedule.getCyclicCells()));
            }
            for (FormulaGroup group : stuck) {
                log.debug("Group {}!{} interleaves with other items, evaluating it cell by cell",
                        group.getSheet(), group.getRangeLabel());
                groups.remove(group);
                dissolve(group, singles, formulas);
            }
        }
    }

    /**
     * Plan made of single cells only, following the cell schedule.
     */
    public EvaluationPlan planWithoutGroups(Map<CellAddress, String> formulas, ScheduleResult schedule) {
        List<PlanItem> items = new ArrayList<>(schedule.getOrder().size());
        for (CellAddress cell : schedule.getOrder()) {
            items.add(new SingleCellItem(cell, formulas.get(cell)));
        }
        log.info("Evaluation plan: {} single cells (vectorization disabled)", items.size());
        return new EvaluationPlan(Collections.unmodifiableList(items),
                Collections.unmodifiableSet(schedule.getCyclicCells()));
    }

    /**
     * Loop direction satisfying every edge between members, or null when no direction works.
     */
    private static FormulaGroup orient(FormulaGroup group, DependencyGraph graph, ScheduleResult schedule) {
        Set<CellAddress> members = new LinkedHashSet<>(group.getMembers());
        boolean forward = false;
        boolean backward = false;
        for (CellAddress member : members) {
            if (schedule.getCyclicCells().contains(member)) {
                return null;
            }
            for (CellAddress source : graph.getPredecessors(member)) {
                if (!members.contains(source)) {
                    continue;
                }
                if (group.indexOf(source) < group.indexOf(member)) {
                    forward = true;
                } else {
                    backward = true;
                }
            }
        }
        if (forward && backward) {
            return null;
        }
        return backward ? group.toBuilder().descending(true).build() : group;
    }

    private static void dissolve(FormulaGroup group, List<SingleCellItem> singles, Map<CellAddress, String> formulas) {
        for (CellAddress member : group.getMembers()) {
            singles.add(new SingleCellItem(member, formulas.get(member)));
        }
    }

    private static List<PlanItem> order(List<PlanItem> items, DependencyGraph graph,
                                        Map<CellAddress, Integer> position, Map<CellAddress, Integer> cycleOf) {
        Map<CellAddress, Integer> owner = new HashMap<>();
        for (int i = 0; i < items.size(); i++) {
            for (CellAddress cell : items.get(i).getCells()) {
                owner.put(cell, i);
            }
        }
        List<Set<Integer>> edges = new ArrayList<>(items.size());
        int[] inDegree = new int[items.size()];
        for (int i = 0; i < items.size(); i++) {
            Set<Integer> targets = new LinkedHashSet<>();
            for (CellAddress cell : items.get(i).getCells()) {
                Integer cellCycle = cycleOf.get(cell);
                for (CellAddress next : graph.getSuccessors(cell)) {
                    Integer target = owner.get(next);
                    if (target == null || target == i) {
                        continue;
                    }
                    if (cellCycle != null && cellCycle.equals(cycleOf.get(next))) {
                        continue;
                    }
                    targets.add(target);
                }
            }
            edges.add(targets);
        }
        for (Set<Integer> targets : edges) {
            for (int target : targets) {
                inDegree[target]++;
            }
        }
        int[] firstPositions = new int[items.size()];
        for (int i = 0; i < items.size(); i++) {
            firstPositions[i] = firstPosition(items.get(i), position);
        }
        PriorityQueue<Integer> ready = new PriorityQueue<>(Comparator.comparingInt((Integer i) -> firstPositions[i]));
        for (int i = 0; i < items.size(); i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        List<PlanItem> ordered = new ArrayList<>(items.size());
        while (!ready.isEmpty()) {
            int current = ready.poll();
            ordered.add(items.get(current));
            for (int target : edges.get(current)) {
                if (--inDegree[target] == 0) {
                    ready.add(target);
                }
            }
        }
        return ordered;
    }

    private static int firstPosition(PlanItem item, Map<CellAddress, Integer> position) {
        int first = Integer.MAX_VALUE;
        for (CellAddress cell : item.getCells()) {
            first = Math.min(first, position.getOrDefault(cell, Integer.MAX_VALUE));
        }
        return first;
    }
}
