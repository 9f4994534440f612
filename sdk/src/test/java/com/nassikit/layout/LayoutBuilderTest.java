package com.nassikit.layout;

import com.nassikit.tree.ControlNode;
import com.nassikit.tree.ControlNode.Statement;
import com.nassikit.tree.ControlNode.SwitchCase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for building layout trees from control-flow trees.
 */
class LayoutBuilderTest {

    private LayoutBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new LayoutBuilder();
    }

    private LayoutNode layout(ControlNode node) {
        return builder.build(node).orElseThrow();
    }

    @Nested
    class Statements {

        @Test
        void assignment_isNormalizedAndMeasured() {
            LayoutNode.Statement node = (LayoutNode.Statement) layout(Statement.of("int total = 0;"));

            assertEquals("total ← 0", node.text());
            assertEquals(83, node.width());
            assertEquals(30, node.height());
        }

        @Test
        void shortText_usesMinimumWidth() {
            assertEquals(64, layout(Statement.of("i++;")).width());
        }

        @Test
        void blankStatement_rendersNothing() {
            assertTrue(builder.build(Statement.of("   ")).isEmpty());
            assertTrue(builder.build(null).isEmpty());
        }

        @Test
        void customEstimator_drivesWidth() {
            LayoutBuilder wide = new LayoutBuilder(TextWidthEstimator.perCharacter(10));

            assertEquals(100, wide.build(Statement.of("abcdefgh")).orElseThrow().width());
            assertEquals(64, wide.build(Statement.of("abc")).orElseThrow().width());
        }

        @Test
        void unknownNode_becomesStatement() {
            assertEquals("foo bar", ((LayoutNode.Statement) layout(new ControlNode.Unknown("label", "foo   bar"))).text());
            assertEquals("label", ((LayoutNode.Statement) layout(new ControlNode.Unknown("label", null))).text());
            assertEquals("unknown", ((LayoutNode.Statement) layout(new ControlNode.Unknown(" ", ""))).text());
        }
    }

    @Nested
    class Sequences {

        @Test
        void blankChildrenAreDropped() {
            LayoutNode.Sequence node = (LayoutNode.Sequence) layout(ControlNode.Sequence.of(
                Statement.of("a();"), Statement.of("  "), Statement.of("b = 2;")));

            assertEquals(2, node.children().size());
            assertEquals(60, node.height());
            assertEquals(64, node.width());
        }

        @Test
        void emptySequence_showsEmptyLabel() {
            LayoutNode.Sequence node = (LayoutNode.Sequence) layout(ControlNode.Sequence.of());

            assertEquals(1, node.children().size());
            assertEquals("(empty)", ((LayoutNode.Statement) node.children().get(0)).text());
            assertEquals(69, node.width());
        }

        @Test
        void widthIsWidestChild_heightIsSum() {
            LayoutNode.Sequence node = (LayoutNode.Sequence) layout(ControlNode.Sequence.of(
                Statement.of("System.out.println(\"a fairly long line of output\");"),
                ControlNode.Loop.of("while", "x", List.of(Statement.of("x = next();"))),
                Statement.of("done();")));

            int maxWidth = 0;
            int totalHeight = 0;
            for (LayoutNode child : node.children()) {
                maxWidth = Math.max(maxWidth, child.width());
                totalHeight += child.height();
            }
            assertEquals(maxWidth, node.width());
            assertEquals(totalHeight, node.height());
        }
    }

    @Nested
    class Ifs {

        @Test
        void missingElse_isBareSentinel() {
            LayoutNode.If node = (LayoutNode.If) layout(
                ControlNode.If.simple("x > 0", List.of(Statement.of("y = 1;"))));

            assertEquals("x > 0", node.condition());
            assertInstanceOf(LayoutNode.Sequence.class, node.thenBranch());
            LayoutNode.Statement elseBranch = assertInstanceOf(LayoutNode.Statement.class, node.elseBranch());
            assertEquals("∅", elseBranch.text());
            assertEquals(64, node.leftWidth());
            assertEquals(64, node.rightWidth());
            assertEquals(128, node.width());
            assertEquals(40, node.headerHeight());
            assertEquals(70, node.height());
        }

        @Test
        void emptyThenBranch_showsSentinel() {
            LayoutNode.If node = (LayoutNode.If) layout(ControlNode.If.withElse(
                "flag", List.of(), List.of(Statement.of("run();"))));

            LayoutNode.Sequence thenBranch = (LayoutNode.Sequence) node.thenBranch();
            assertEquals("∅", ((LayoutNode.Statement) thenBranch.children().get(0)).text());
        }

        @Test
        void elseWithOnlyBlankStatements_isSentinelSequence() {
            LayoutNode.If node = (LayoutNode.If) layout(ControlNode.If.withElse(
                "flag", List.of(Statement.of("a();")), List.of(Statement.of(" "))));

            LayoutNode.Sequence elseBranch = assertInstanceOf(LayoutNode.Sequence.class, node.elseBranch());
            assertEquals("∅", ((LayoutNode.Statement) elseBranch.children().get(0)).text());
        }

        @Test
        void blankCondition_usesFallback() {
            LayoutNode.If node = (LayoutNode.If) layout(ControlNode.If.simple("  ", List.of()));

            assertEquals("condition", node.condition());
        }

        @Test
        void branchHeight_isTallerBranch() {
            LayoutNode.If node = (LayoutNode.If) layout(ControlNode.If.withElse("c",
                List.of(Statement.of("a();")),
                List.of(Statement.of("b();"), Statement.of("c();"), Statement.of("d();"))));

            assertEquals(90, node.branchHeight());
            assertEquals(node.headerHeight() + 90, node.height());
            assertEquals(node.leftWidth() + node.rightWidth(), node.width());
        }
    }

    @Nested
    class Loops {

        @Test
        void doWhile_hasFooter() {
            LayoutNode.Loop node = (LayoutNode.Loop) layout(ControlNode.Loop.of(
                ControlNode.Loop.DO_WHILE, "i < 10", List.of(Statement.of("i++;"))));

            assertEquals("do", node.header());
            assertEquals("while (i < 10)", node.footer());
            assertEquals(0, node.bodyInsetWidth());
            assertEquals(90, node.height());
        }

        @Test
        void forLoop_keepsConditionText() {
            LayoutNode.Loop node = (LayoutNode.Loop) layout(ControlNode.Loop.of(
                ControlNode.Loop.FOR, "int i = 0; i < n; i++", List.of(Statement.of("sum += i;"))));

            assertEquals("for (int i = 0; i < n; i++)", node.header());
            assertEquals(28, node.bodyInsetWidth());
        }

        @Test
        void emptyBody_showsEmptyLabel() {
            LayoutNode.Loop node = (LayoutNode.Loop) layout(ControlNode.Loop.of("while", null, List.of()));

            assertEquals("while (condition)", node.header());
            LayoutNode.Sequence body = (LayoutNode.Sequence) node.body();
            assertEquals("(empty)", ((LayoutNode.Statement) body.children().get(0)).text());
        }
    }

    @Nested
    class Switches {

        @Test
        void mergedLabels_shareOneColumn() {
            LayoutNode.Switch node = (LayoutNode.Switch) layout(ControlNode.Switch.of("day",
                SwitchCase.of("1"),
                SwitchCase.of("2", Statement.of("doA();"), Statement.of("break;")),
                SwitchCase.of("default", Statement.of("doB();"))));

            assertEquals(2, node.cases().size());
            assertEquals("1, 2", node.cases().get(0).label());
            assertEquals("default", node.cases().get(1).label());
            assertEquals(64, node.cases().get(0).width());
            assertEquals(69, node.cases().get(1).width());
            assertEquals(133, node.width());
            assertEquals(31, node.selectorBandHeight());
            assertEquals(24, node.labelBandHeight());
            assertEquals(30, node.branchHeight());
            assertEquals(85, node.height());
        }

        @Test
        void fallthrough_makesColumnTaller() {
            LayoutNode.Switch node = (LayoutNode.Switch) layout(ControlNode.Switch.of("day",
                SwitchCase.of("1"),
                SwitchCase.of("2", Statement.of("doA();")),
                SwitchCase.of("default", Statement.of("doB();"))));

            LayoutNode.Sequence first = (LayoutNode.Sequence) node.cases().get(0).body();
            assertEquals(2, first.children().size());
            assertEquals(60, node.branchHeight());
        }

        @Test
        void caseWithoutCode_showsEmptyLabel() {
            LayoutNode.Switch node = (LayoutNode.Switch) layout(ControlNode.Switch.of(null,
                SwitchCase.of("1", Statement.of("break;")),
                SwitchCase.of("default", Statement.of("x();"))));

            assertEquals("selector", node.expression());
            assertEquals("(empty)", ((LayoutNode.Statement) node.cases().get(0).body()).text());
        }

        @Test
        void widthIsSumOfCaseWidths() {
            LayoutNode.Switch node = (LayoutNode.Switch) layout(ControlNode.Switch.of(
                "computeTheSelectorValueFromAllInputs(a, b, c)",
                SwitchCase.of("A", Statement.of("a();"), Statement.of("break;")),
                SwitchCase.of("B", Statement.of("b();"), Statement.of("break;")),
                SwitchCase.of("default", Statement.of("c();"))));

            int sum = 0;
            for (LayoutNode.Switch.Case entry : node.cases()) {
                sum += entry.width();
            }
            assertEquals(sum, node.width());
            assertEquals(node.selectorBandHeight() + node.labelBandHeight() + node.branchHeight(), node.height());
            assertTrue(node.selectorBandHeight() >= 30 && node.selectorBandHeight() <= 60);
        }
    }

    @Nested
    class Tries {

        @Test
        void catchesAndFinally_areLaidOut() {
            ControlNode.Try tryNode = new ControlNode.Try(
                List.of(Statement.of("read();")),
                List.of(new ControlNode.CatchClause(null, List.of(Statement.of("log(e);")))),
                List.of(Statement.of("close();")));

            LayoutNode.Try node = (LayoutNode.Try) layout(tryNode);

            assertEquals("catch", node.catches().get(0).exception());
            assertTrue(node.hasFinally());
            assertEquals(30 + 30 + 24 + 30 + 24 + 30, node.height());
        }

        @Test
        void emptyFinally_isAbsent() {
            LayoutNode.Try node = (LayoutNode.Try) layout(
                new ControlNode.Try(List.of(Statement.of("read();")), List.of(), List.of()));

            assertFalse(node.hasFinally());
            assertEquals(60, node.height());
        }
    }

    @Test
    void sameTree_producesEqualLayouts() {
        ControlNode tree = ControlNode.Sequence.of(
            Statement.of("int x = read();"),
            ControlNode.If.withElse("x > 0",
                List.of(ControlNode.Loop.of("while", "x > 0", List.of(Statement.of("x--;")))),
                List.of(ControlNode.Switch.of("x",
                    SwitchCase.of("-1", Statement.of("fail();"), Statement.of("break;")),
                    SwitchCase.of("default", Statement.of("ignore();"))))));

        assertEquals(layout(tree), layout(tree));
        assertEquals(layout(tree), new LayoutBuilder().build(tree).orElseThrow());
    }
}
