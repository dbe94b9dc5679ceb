package com.example.demo.formulaengine.pattern;

import com.example.demo.formulaengine.model.AxisPosition;
import com.example.demo.formulaengine.model.PatternKey;
import com.example.demo.formulaengine.model.ReferenceDescriptor;
import com.example.demo.formulaengine.parser.ReferenceResolver;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PatternNormalizer}.
 */
public class PatternNormalizerTest {

    private final PatternNormalizer normalizer = new PatternNormalizer(new ReferenceResolver());

    /**
     * Test that formulas produced by dragging down share one key.
     */
    @Test
    public void testDraggedFormulasShareAKey() {
        PatternKey d2 = normalizer.computePattern("=B2*C2", "Sheet1", 4, 2);
        PatternKey d3 = normalizer.computePattern("=B3*C3", "Sheet1", 4, 3);
        assertEquals(d2, d3);
        assertEquals(d2.hashCode(), d3.hashCode());
        assertEquals("@0*@1", d2.getSkeleton());

        ReferenceDescriptor first = d2.getReferences().get(0);
        assertEquals(AxisPosition.relative(-2), first.getStartColumn());
        assertEquals(AxisPosition.relative(0), first.getStartRow());
        assertNull(first.getSheet());
    }

    @Test
    public void testAnchorsArePartOfTheKey() {
        PatternKey relative = normalizer.computePattern("=B3*C3", "Sheet1", 4, 3);
        PatternKey anchoredRow = normalizer.computePattern("=B$2*C3", "Sheet1", 4, 3);
        assertNotEquals(relative, anchoredRow);
        assertEquals(AxisPosition.absolute(2), anchoredRow.getReferences().get(0).getStartRow());

        PatternKey absolute2 = normalizer.computePattern("=$A$1+B2", "Sheet1", 3, 2);
        PatternKey absolute3 = normalizer.computePattern("=$A$1+B3", "Sheet1", 3, 3);
        assertEquals(absolute2, absolute3);
    }

    @Test
    public void testDifferentTextOrSheetGivesDifferentKeys() {
        assertNotEquals(normalizer.computePattern("=B2*C2", "Sheet1", 4, 2),
                normalizer.computePattern("=B2+C2", "Sheet1", 4, 2));
        assertNotEquals(normalizer.computePattern("=B2*C2", "Sheet1", 4, 2),
                normalizer.computePattern("=B2*C2", "Sheet2", 4, 2));
        assertNotEquals(normalizer.computePattern("=Other!B2", "Sheet1", 4, 2),
                normalizer.computePattern("=B2", "Sheet1", 4, 2));
    }

    @Test
    public void testRangesAndHorizontalDrag() {
        PatternKey b4 = normalizer.computePattern("=SUM(B1:B3)", "Sheet1", 2, 4);
        PatternKey c4 = normalizer.computePattern("=SUM(C1:C3)", "Sheet1", 3, 4);
        assertEquals(b4, c4);
        assertEquals("SUM(@0)", b4.getSkeleton());
        assertEquals(AxisPosition.relative(-1), b4.getReferences().get(0).getEndRow());
    }

    @Test
    public void testFormulaWithoutReferences() {
        PatternKey key = normalizer.computePattern("=1+2", "Sheet1", 1, 1);
        assertEquals("1+2", key.getSkeleton());
        assertTrue(key.getReferences().isEmpty());
    }
}
