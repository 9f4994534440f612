package com.nassikit.layout.geometry;

import com.nassikit.layout.LayoutNode;
import com.nassikit.layout.TextMeasure;
import com.nassikit.layout.TextWidthEstimator;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SwitchGeometryTest {

    @Test
    void shortSelector_keepsCaseWidths() {
        SwitchGeometry geometry = SwitchGeometry.fit(55, new int[] {64, 64, 64});

        assertArrayEquals(new int[] {64, 64, 64}, geometry.caseWidths());
        assertEquals(192, geometry.width());
        assertEquals(37, geometry.selectorBandHeight());
        assertEquals(24, geometry.labelBandHeight());
    }

    @Test
    void singleColumn_carriesBothRuns() {
        SwitchGeometry geometry = SwitchGeometry.fit(300, new int[] {64});

        assertArrayEquals(new int[] {462}, geometry.caseWidths());
        assertEquals(60, geometry.selectorBandHeight());
    }

    @Test
    void twoColumns_widenLeftThenDefault() {
        SwitchGeometry geometry = SwitchGeometry.fit(300, new int[] {64, 64});

        assertArrayEquals(new int[] {231, 231}, geometry.caseWidths());
        assertEquals(462, geometry.width());
    }

    @Test
    void leftRunExtra_isSplitOverNonDefaultColumns() {
        SwitchGeometry geometry = SwitchGeometry.fit(300, new int[] {64, 64, 64});

        assertArrayEquals(new int[] {116, 115, 231}, geometry.caseWidths());
        assertEquals(462, geometry.width());
        assertEquals(60, geometry.selectorBandHeight());
    }

    @Test
    void fit_doesNotModifyInput() {
        int[] preferred = {64, 64};
        SwitchGeometry.fit(300, preferred);
        assertArrayEquals(new int[] {64, 64}, preferred);
    }

    @Test
    void build_widthIsSumOfCases() {
        TextMeasure measure = new TextMeasure(TextWidthEstimator.DEFAULT);
        LayoutNode body = new LayoutNode.Statement("doA()", 64, 30);
        List<SwitchGeometry.CaseInput> cases = List.of(
            new SwitchGeometry.CaseInput("1, 2", body, 64),
            new SwitchGeometry.CaseInput("default", body, 64));

        LayoutNode.Switch node = SwitchGeometry.build("day", cases, 30, measure);

        assertEquals(64, node.cases().get(0).width());
        assertEquals(69, node.cases().get(1).width());
        assertEquals(133, node.width());
        assertEquals(31, node.selectorBandHeight());
        assertEquals(31 + 24 + 30, node.height());
    }

    @Test
    void build_narrowCasesGrowToSelectorWidth() {
        TextMeasure measure = new TextMeasure(TextWidthEstimator.DEFAULT);
        LayoutNode body = new LayoutNode.Statement("x", 64, 30);
        List<SwitchGeometry.CaseInput> cases = List.of(
            new SwitchGeometry.CaseInput("a", body, 64),
            new SwitchGeometry.CaseInput("default", body, 64));

        LayoutNode.Switch node = SwitchGeometry.build("someRatherLongSelectorExpression()", cases, 30, measure);

        int sum = 0;
        for (LayoutNode.Switch.Case entry : node.cases()) {
            sum += entry.width();
        }
        assertEquals(sum, node.width());
        assertTrue(node.width() >= measure.boxWidth("someRatherLongSelectorExpression()"));
    }
}
