package com.nassikit.layout.geometry;

import com.nassikit.layout.LayoutNode;
import com.nassikit.layout.TextMeasure;
import com.nassikit.layout.TextWidthEstimator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IfGeometryTest {

    @Test
    void shortCondition_keepsPreferredWidthsAndBaseHeight() {
        IfGeometry geometry = IfGeometry.fit(55, 64, 64);

        assertEquals(64, geometry.leftWidth());
        assertEquals(64, geometry.rightWidth());
        assertEquals(128, geometry.width());
        assertEquals(40, geometry.headerHeight());
    }

    @Test
    void longCondition_widensBothSidesAndCapsHeader() {
        // 40 characters: 280 + padding
        IfGeometry geometry = IfGeometry.fit(300, 64, 64);

        assertEquals(231, geometry.leftWidth());
        assertEquals(231, geometry.rightWidth());
        assertEquals(462, geometry.width());
        assertEquals(60, geometry.headerHeight());
    }

    @Test
    void sidesAlwaysClearHalfTheCondition() {
        for (int conditionWidth = 0; conditionWidth <= 600; conditionWidth += 37) {
            IfGeometry geometry = IfGeometry.fit(conditionWidth, 64, 90);
            double required = conditionWidth / 2.0 + 10;

            assertTrue(geometry.leftWidth() >= required, "left at " + conditionWidth);
            assertTrue(geometry.rightWidth() >= required, "right at " + conditionWidth);
            assertEquals(geometry.leftWidth() + geometry.rightWidth(), geometry.width());
            assertTrue(geometry.headerHeight() >= 40 && geometry.headerHeight() <= 60);
        }
    }

    @Test
    void unevenBranches_keepTheirOwnWidths() {
        IfGeometry geometry = IfGeometry.fit(55, 200, 64);

        assertEquals(200, geometry.leftWidth());
        assertEquals(64, geometry.rightWidth());
        assertEquals(264, geometry.width());
    }

    @Test
    void build_usesTallerBranchForBranchHeight() {
        LayoutNode thenBranch = new LayoutNode.Statement("a", 64, 30);
        LayoutNode elseBranch = new LayoutNode.Statement("b", 80, 90);

        LayoutNode.If node = IfGeometry.build("x > 0", thenBranch, elseBranch,
            new TextMeasure(TextWidthEstimator.DEFAULT));

        assertEquals(90, node.branchHeight());
        assertEquals(node.headerHeight() + 90, node.height());
        assertEquals(node.leftWidth() + node.rightWidth(), node.width());
        assertEquals(80, node.rightWidth());
    }
}
