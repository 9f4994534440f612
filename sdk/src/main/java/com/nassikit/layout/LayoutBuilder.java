package com.nassikit.layout;

import com.nassikit.layout.geometry.IfGeometry;
import com.nassikit.layout.geometry.LoopGeometry;
import com.nassikit.layout.geometry.SwitchGeometry;
import com.nassikit.layout.geometry.TryGeometry;
import com.nassikit.text.StatementText;
import com.nassikit.tree.ControlNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.nassikit.layout.StructogramConstants.CATCH_FALLBACK;
import static com.nassikit.layout.StructogramConstants.CONDITION_FALLBACK;
import static com.nassikit.layout.StructogramConstants.EMPTY_BODY_LABEL;
import static com.nassikit.layout.StructogramConstants.NO_ELSE_LABEL;
import static com.nassikit.layout.StructogramConstants.ROW_HEIGHT;
import static com.nassikit.layout.StructogramConstants.SELECTOR_FALLBACK;

/**
 * Turns a control-flow tree into a layout tree.
 * <p>
 * The builder holds no state besides its text measure, so one instance can lay out any
 * number of trees, from any thread. Malformed input never fails: blank text falls back to
 * placeholder labels and statements without content are dropped.
 */
public class LayoutBuilder {

    private final TextMeasure measure;

    public LayoutBuilder() {
        this(TextWidthEstimator.DEFAULT);
    }

    public LayoutBuilder(TextWidthEstimator estimator) {
        this.measure = new TextMeasure(estimator);
    }

    public TextWidthEstimator estimator() {
        return measure.estimator();
    }

    /**
     * Lay out a whole tree.
     *
     * @return the layout, or empty if there is no tree or it has no renderable root
     */
    public Optional<LayoutNode> build(ControlNode root) {
        return Optional.ofNullable(toLayoutNode(root));
    }

    /**
     * Lay out a single node.
     *
     * @return the layout node, or null if the node renders nothing
     */
    public LayoutNode toLayoutNode(ControlNode node) {
        if (node == null) {
            return null;
        }

        if (node instanceof ControlNode.Statement statement) {
            String text = StatementText.normalizeStatementText(statement.text());
            return text != null ? createStatement(text) : null;
        }

        if (node instanceof ControlNode.Sequence sequence) {
            return toSequence(sequence.children());
        }

        if (node instanceof ControlNode.If ifNode) {
            return toIf(ifNode);
        }

        if (node instanceof ControlNode.Loop loop) {
            LayoutNode body = toSequence(loop.children());
            String condition = StatementText.normalizeLabel(loop.condition(), CONDITION_FALLBACK);
            return LoopGeometry.build(loop.loopKind(), condition, body, measure);
        }

        if (node instanceof ControlNode.Switch switchNode) {
            return toSwitch(switchNode);
        }

        if (node instanceof ControlNode.Try tryNode) {
            return toTry(tryNode);
        }

        ControlNode.Unknown unknown = (ControlNode.Unknown) node;
        String kind = unknown.kind() == null || unknown.kind().isBlank() ? "unknown" : unknown.kind().trim();
        return createStatement(StatementText.normalizeLabel(unknown.text(), kind));
    }

    /**
     * Lay out a block; an empty block becomes one {@code "(empty)"} statement.
     */
    public LayoutNode.Sequence toSequence(List<ControlNode> nodes) {
        return toSequence(nodes, EMPTY_BODY_LABEL);
    }

    /**
     * Lay out a block; an empty block becomes one statement showing {@code emptyLabel}.
     */
    public LayoutNode.Sequence toSequence(List<ControlNode> nodes, String emptyLabel) {
        List<LayoutNode> children = new ArrayList<>();
        if (nodes != null) {
            for (ControlNode entry : nodes) {
                LayoutNode child = toLayoutNode(entry);
                if (child != null) {
                    children.add(child);
                }
            }
        }
        if (children.isEmpty()) {
            children.add(createStatement(emptyLabel));
        }
        return LayoutNode.Sequence.of(children);
    }

    public LayoutNode.Statement createStatement(String text) {
        return new LayoutNode.Statement(text, measure.boxWidth(text), ROW_HEIGHT);
    }

    private LayoutNode toIf(ControlNode.If node) {
        String condition = StatementText.normalizeLabel(node.condition(), CONDITION_FALLBACK);
        LayoutNode thenBranch = toSequence(node.thenBranch(), NO_ELSE_LABEL);
        // no source else at all: a bare sentinel, drawn centered
        LayoutNode elseBranch = node.elseBranch().isEmpty()
            ? createStatement(NO_ELSE_LABEL)
            : toSequence(node.elseBranch(), NO_ELSE_LABEL);
        return IfGeometry.build(condition, thenBranch, elseBranch, measure);
    }

    private LayoutNode toSwitch(ControlNode.Switch node) {
        String expression = StatementText.normalizeLabel(node.condition(), SELECTOR_FALLBACK);

        List<SwitchGeometry.CaseInput> cases = new ArrayList<>();
        int branchHeight = ROW_HEIGHT;
        for (SwitchCaseMerger.MergedCase merged : SwitchCaseMerger.merge(node.cases())) {
            LayoutNode body = merged.hasRenderableBody()
                ? toSequence(merged.body())
                : createStatement(EMPTY_BODY_LABEL);
            branchHeight = Math.max(branchHeight, body.height());
            cases.add(new SwitchGeometry.CaseInput(merged.label(), body, body.width()));
        }

        return SwitchGeometry.build(expression, cases, branchHeight, measure);
    }

    private LayoutNode toTry(ControlNode.Try node) {
        LayoutNode body = toSequence(node.children());

        List<LayoutNode.Try.Catch> catches = new ArrayList<>(node.catches().size());
        for (ControlNode.CatchClause clause : node.catches()) {
            catches.add(new LayoutNode.Try.Catch(
                StatementText.normalizeLabel(clause.exception(), CATCH_FALLBACK),
                toSequence(clause.body())));
        }

        LayoutNode finallyBranch = node.finallyBranch().isEmpty() ? null : toSequence(node.finallyBranch());
        return TryGeometry.build(body, catches, finallyBranch, measure);
    }
}
