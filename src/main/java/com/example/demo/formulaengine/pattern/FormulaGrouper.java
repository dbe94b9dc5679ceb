package com.example.demo.formulaengine.pattern;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.FormulaGroup;
import com.example.demo.formulaengine.model.GroupDirection;
import com.example.demo.formulaengine.model.PatternKey;
import com.example.demo.formulaengine.model.SingleCellItem;
import com.example.demo.formulaengine.model.TableDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Collapses dragged formulas into vectorized groups.
 *
 * Cells are bucketed by {@link PatternKey}. Inside a bucket, runs of at least two cells in
 * consecutive rows of one column become vertical groups first; the cells left over are then
 * scanned for runs in consecutive columns of one row. Anything not in a run stays a single.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FormulaGrouper {

    private static final int MIN_GROUP_SIZE = 2;

    private final PatternNormalizer patternNormalizer;

    public GroupingResult group(List<CellRecord> formulaCells) {
        return group(formulaCells, Collections.emptyMap());
    }

    public GroupingResult group(List<CellRecord> formulaCells, Map<String, TableDefinition> tables) {
        Map<CellAddress, Integer> inputOrder = new HashMap<>();
        Map<CellAddress, CellRecord> byAddress = new HashMap<>();
        Map<PatternKey, List<CellAddress>> buckets = new LinkedHashMap<>();
        List<CellAddress> unpatterned = new ArrayList<>();

        for (CellRecord cell : formulaCells) {
            CellAddress address = cell.getAddress();
            inputOrder.put(address, inputOrder.size());
            byAddress.put(address, cell);
            PatternKey key;
            try {
                key = patternNormalizer.computePattern(cell.getFormula(), address.getSheet(),
                        address.getColumn(), address.getRow(), tables);
            } catch (RuntimeException e) {
                log.warn("No pattern for {} ({}), evaluating it on its own", address, e.getMessage());
                unpatterned.add(address);
                continue;
            }
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(address);
        }

        List<FormulaGroup> groups = new ArrayList<>();
        List<CellAddress> singles = new ArrayList<>(unpatterned);
        for (Map.Entry<PatternKey, List<CellAddress>> bucket : buckets.entrySet()) {
            List<CellAddress> cells = bucket.getValue();
            if (cells.size() < MIN_GROUP_SIZE) {
                singles.addAll(cells);
                continue;
            }
            Set<CellAddress> claimed = new HashSet<>();
            collectRuns(cells, claimed, GroupDirection.VERTICAL, bucket.getKey(), byAddress, groups);
            List<CellAddress> remaining = new ArrayList<>();
            for (CellAddress cell : cells) {
                if (!claimed.contains(cell)) {
                    remaining.add(cell);
                }
            }
            collectRuns(remaining, claimed, GroupDirection.HORIZONTAL, bucket.getKey(), byAddress, groups);
            for (CellAddress cell : cells) {
                if (!claimed.contains(cell)) {
                    singles.add(cell);
                }
            }
        }

        groups.sort(Comparator.comparing(FormulaGroup::getAnchor));
        singles.sort(Comparator.comparing(inputOrder::get));
        List<SingleCellItem> singleItems = new ArrayList<>(singles.size());
        for (CellAddress address : singles) {
            singleItems.add(new SingleCellItem(address, byAddress.get(address).getFormula()));
        }
        log.debug("Grouped {} formula cells into {} groups and {} singles",
                formulaCells.size(), groups.size(), singleItems.size());
        return new GroupingResult(groups, singleItems);
    }

    /**
     * Finds maximal runs along one direction. Cells of a bucket all live on the same sheet,
     * so the line key is the column (vertical) or the row (horizontal).
     */
    private static void collectRuns(List<CellAddress> cells, Set<CellAddress> claimed, GroupDirection direction,
                                    PatternKey key, Map<CellAddress, CellRecord> byAddress,
                                    List<FormulaGroup> groups) {
        boolean vertical = direction == GroupDirection.VERTICAL;
        Function<CellAddress, Integer> line = vertical ? CellAddress::getColumn : CellAddress::getRow;
        Function<CellAddress, Integer> position = vertical ? CellAddress::getRow : CellAddress::getColumn;

        Map<Integer, TreeMap<Integer, CellAddress>> lines = new TreeMap<>();
        for (CellAddress cell : cells) {
            lines.computeIfAbsent(line.apply(cell), k -> new TreeMap<>()).put(position.apply(cell), cell);
        }
        for (TreeMap<Integer, CellAddress> cellsOnLine : lines.values()) {
            List<CellAddress> run = new ArrayList<>();
            int previous = Integer.MIN_VALUE;
            for (Map.Entry<Integer, CellAddress> entry : cellsOnLine.entrySet()) {
                if (!run.isEmpty() && entry.getKey() != previous + 1) {
                    flushRun(run, claimed, direction, key, byAddress, groups);
                    run = new ArrayList<>();
                }
                run.add(entry.getValue());
                previous = entry.getKey();
            }
            flushRun(run, claimed, direction, key, byAddress, groups);
        }
    }

    private static void flushRun(List<CellAddress> run, Set<CellAddress> claimed, GroupDirection direction,
                                 PatternKey key, Map<CellAddress, CellRecord> byAddress,
                                 List<FormulaGroup> groups) {
        if (run.size() < MIN_GROUP_SIZE) {
            return;
        }
        claimed.addAll(run);
        groups.add(FormulaGroup.builder()
                .direction(direction)
                .members(Collections.unmodifiableList(new ArrayList<>(run)))
                .representativeFormula(byAddress.get(run.get(0)).getFormula())
                .pattern(key)
                .build());
    }
}
