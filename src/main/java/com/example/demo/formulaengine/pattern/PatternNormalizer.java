package com.example.demo.formulaengine.pattern;

import com.example.demo.formulaengine.model.AxisPosition;
import com.example.demo.formulaengine.model.PatternKey;
import com.example.demo.formulaengine.model.Reference;
import com.example.demo.formulaengine.model.ReferenceDescriptor;
import com.example.demo.formulaengine.model.ReferenceKind;
import com.example.demo.formulaengine.model.TableDefinition;
import com.example.demo.formulaengine.parser.FormulaTokenizer;
import com.example.demo.formulaengine.parser.ReferenceResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Computes the drag-invariant {@link PatternKey} of a formula.
 *
 * Relative axes are stored as offsets from the cell holding the formula and '$' axes as their
 * literal value, so =B2*C2 in D2 and =B3*C3 in D3 produce equal keys while =B$2*C3 in D3 does
 * not.
 */
@Component
@RequiredArgsConstructor
public class PatternNormalizer {

    private final ReferenceResolver referenceResolver;

    public PatternKey computePattern(String formula, String currentSheet, int cellColumn, int cellRow) {
        return computePattern(formula, currentSheet, cellColumn, cellRow, Collections.emptyMap());
    }

    public PatternKey computePattern(String formula, String currentSheet, int cellColumn, int cellRow,
                                     Map<String, TableDefinition> tables) {
        String body = FormulaTokenizer.stripEquals(formula);
        List<Reference> references = referenceResolver.extractReferences(body, currentSheet, tables);

        StringBuilder skeleton = new StringBuilder(body.length());
        List<ReferenceDescriptor> descriptors = new ArrayList<>(references.size());
        int cursor = 0;
        for (int i = 0; i < references.size(); i++) {
            Reference ref = references.get(i);
            skeleton.append(body, cursor, ref.getSpanStart()).append('@').append(i);
            cursor = ref.getSpanEnd();
            descriptors.add(describe(ref, currentSheet, cellColumn, cellRow));
        }
        skeleton.append(body, cursor, body.length());
        return new PatternKey(currentSheet, skeleton.toString(), Collections.unmodifiableList(descriptors));
    }

    private static ReferenceDescriptor describe(Reference ref, String currentSheet, int cellColumn, int cellRow) {
        String sheet = ref.isExternal() || !ref.getSheet().equals(currentSheet) ? ref.getSheet() : null;
        ReferenceDescriptor.ReferenceDescriptorBuilder builder = ReferenceDescriptor.builder()
                .kind(ref.getKind())
                .externalFile(ref.getExternalFile())
                .sheet(sheet);
        if (ref.isTable()) {
            return builder.tableName(ref.getTableName())
                    .tableColumn(ref.getTableColumn())
                    .tableEndColumn(ref.getTableEndColumn())
                    .tableArea(ref.getTableArea())
                    .build();
        }
        builder.startColumn(axis(ref.isStartColumnAbsolute(), ref.getStartColumn(), cellColumn))
                .startRow(axis(ref.isStartRowAbsolute(), ref.getStartRow(), cellRow));
        if (ref.getKind() == ReferenceKind.RANGE) {
            builder.endColumn(axis(ref.isEndColumnAbsolute(), ref.getEndColumn(), cellColumn))
                    .endRow(axis(ref.isEndRowAbsolute(), ref.getEndRow(), cellRow));
        }
        return builder.build();
    }

    private static AxisPosition axis(boolean absolute, int value, int origin) {
        return absolute ? AxisPosition.absolute(value) : AxisPosition.relative(value - origin);
    }
}
