package com.example.demo.formulaengine.graph;

import com.example.demo.formulaengine.config.CompilerProperties;
import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.translator.TranslatedFormula;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Builds the {@link DependencyGraph} from translated formulas.
 *
 * Every reference a formula reads is expanded to the cells it covers and an edge is added from
 * each covered formula cell. Literal cells are not nodes, so they never produce edges. Ranges
 * larger than the configured expansion limit are matched the other way round: each formula
 * cell of the target sheet is tested for containment, which yields the same edges without
 * enumerating huge ranges.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DependencyGraphBuilder {

    private final CompilerProperties properties;

    public DependencyGraph build(Map<CellAddress, TranslatedFormula> translations) {
        return build(translations, properties.getRangeExpansionLimit());
    }

    public DependencyGraph build(Map<CellAddress, TranslatedFormula> translations, long rangeExpansionLimit) {
        DependencyGraph graph = new DependencyGraph();
        for (CellAddress cell : new TreeSet<>(translations.keySet())) {
            graph.addNode(cell);
        }
        Map<String, List<CellAddress>> formulaCellsBySheet = new LinkedHashMap<>();
        for (CellAddress cell : graph.getNodes()) {
            formulaCellsBySheet.computeIfAbsent(cell.getSheet(), k -> new ArrayList<>()).add(cell);
        }

        for (Map.Entry<CellAddress, TranslatedFormula> entry : translations.entrySet()) {
            CellAddress reader = entry.getKey();
            for (Reference reference : entry.getValue().getReferences()) {
                if (reference.isTable()) {
                    continue;
                }
                if (reference.area() <= rangeExpansionLimit) {
                    for (CellAddress source : reference.expand()) {
                        if (graph.contains(source)) {
                            graph.addEdge(source, reader);
                        }
                    }
                } else {
                    for (CellAddress source : formulaCellsBySheet.getOrDefault(reference.getStoreSheet(), List.of())) {
                        if (reference.contains(source)) {
                            graph.addEdge(source, reader);
                        }
                    }
                }
            }
        }
        log.info("Dependency graph: {} formula cells, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }
}
