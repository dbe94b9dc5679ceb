package com.example.demo.formulaengine.service;

import com.example.demo.formulaengine.model.CellAddress;
import com.example.demo.formulaengine.model.CellRecord;
import com.example.demo.formulaengine.model.CrossSheetReference;
import com.example.demo.formulaengine.model.ExternalReference;
import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.model.ReferenceAnalysis;
import com.example.demo.formulaengine.model.ReferenceKind;
import com.example.demo.formulaengine.model.WorkbookSnapshot;
import com.example.demo.formulaengine.parser.ReferenceResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Lists formulas that read other sheets or other workbooks, and collects the external
 * workbooks a calculator will need at run time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceAnalyzer {

    private final ReferenceResolver referenceResolver;

    public ReferenceAnalysis analyse(WorkbookSnapshot workbook) {
        List<CrossSheetReference> crossSheet = new ArrayList<>();
        List<ExternalReference> external = new ArrayList<>();
        Map<String, Set<String>> externalFiles = new TreeMap<>();

        for (CellRecord cell : workbook.getFormulaCells()) {
            CellAddress address = cell.getAddress();
            List<Reference> references = referenceResolver.extractReferences(
                    cell.getFormula(), address.getSheet(), workbook.getTables());
            for (Reference ref : references) {
                if (ref.isTable()) {
                    continue;
                }
                String refType = ref.getKind() == ReferenceKind.RANGE ? "range" : "cell";
                if (ref.isExternal()) {
                    external.add(new ExternalReference(address.getSheet(), address.toA1(), cell.getFormula(),
                            ref.getExternalFile(), ref.getSheet(), refType));
                    externalFiles.computeIfAbsent(ref.getExternalFile(), k -> new TreeSet<>()).add(ref.getSheet());
                } else if (ref.isCrossSheet(address.getSheet())) {
                    crossSheet.add(new CrossSheetReference(address.getSheet(), address.toA1(), cell.getFormula(),
                            ref.getSheet(), refType));
                }
            }
        }
        if (!externalFiles.isEmpty()) {
            log.info("Formulas read {} external workbooks: {}", externalFiles.size(), externalFiles.keySet());
        }
        log.debug("Found {} cross-sheet and {} external references", crossSheet.size(), external.size());
        return new ReferenceAnalysis(
                Collections.unmodifiableList(crossSheet),
                Collections.unmodifiableList(external),
                Collections.unmodifiableMap(externalFiles));
    }

    /**
     * Skeleton of input_files_config.json: each external workbook mapped to an empty path the
     * user fills in before running the calculator.
     */
    public Map<String, String> externalFilesConfig(ReferenceAnalysis analysis) {
        Map<String, String> config = new LinkedHashMap<>();
        for (String file : analysis.getExternalFiles().keySet()) {
            config.put(file, "");
        }
        return config;
    }
}
