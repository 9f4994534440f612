package com.nassikit.layout;

import com.nassikit.text.StatementText;
import com.nassikit.tree.ControlNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups switch cases into the columns of a switch box.
 * <p>
 * Labels without code of their own are merged into the next case that has code. A trailing
 * {@code break} is implied by the notation and removed. A case that does not end in a
 * terminator (break, return, throw, continue, yield) falls through, so its column also shows
 * the code of the following columns up to the next terminator.
 */
public final class SwitchCaseMerger {

    private SwitchCaseMerger() {
    }

    /**
     * One column of a switch box before layout.
     *
     * @param labels case labels shown over the column
     * @param body   statements displayed in the column, fallthrough code included
     */
    public record MergedCase(List<String> labels, List<ControlNode> body) {
        public MergedCase {
            labels = List.copyOf(labels);
            body = List.copyOf(body);
        }

        public String label() {
            return String.join(", ", labels);
        }

        public boolean hasRenderableBody() {
            return SwitchCaseMerger.hasRenderableBody(body);
        }
    }

    private record Group(List<String> labels, List<ControlNode> ownBody, boolean terminates) {
    }

    public static List<MergedCase> merge(List<ControlNode.SwitchCase> cases) {
        List<Group> groups = new ArrayList<>();
        List<String> pendingLabels = new ArrayList<>();

        for (ControlNode.SwitchCase entry : cases) {
            String label = StatementText.normalizeLabel(entry.label(), StructogramConstants.DEFAULT_CASE_LABEL);
            List<ControlNode> ownBody = stripTrailingBreak(entry.body());
            boolean hasBody = hasRenderableBody(ownBody);
            boolean terminates = hasExplicitTerminator(entry.body());

            if (!hasBody && !terminates) {
                pendingLabels.add(label);
                continue;
            }

            List<String> labels = new ArrayList<>(pendingLabels);
            labels.add(label);
            groups.add(new Group(labels, ownBody, terminates));
            pendingLabels.clear();
        }

        if (!pendingLabels.isEmpty()) {
            groups.add(new Group(List.copyOf(pendingLabels), List.of(), false));
        }

        if (groups.isEmpty()) {
            return List.of(new MergedCase(List.of(StructogramConstants.DEFAULT_CASE_LABEL), List.of()));
        }

        // walk backwards so each group can append the already resolved body of the next one
        List<List<ControlNode>> displayed = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            displayed.add(List.of());
        }
        for (int i = groups.size() - 1; i >= 0; i--) {
            Group group = groups.get(i);
            List<ControlNode> nodes = new ArrayList<>(group.ownBody());
            if (!group.terminates() && i + 1 < groups.size()) {
                nodes.addAll(displayed.get(i + 1));
            }
            displayed.set(i, nodes);
        }

        List<MergedCase> merged = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            merged.add(new MergedCase(groups.get(i).labels(), displayed.get(i)));
        }
        return merged;
    }

    /**
     * Remove trailing statements that are exactly {@code break}.
     * Returns the same list when there is nothing to remove.
     */
    static List<ControlNode> stripTrailingBreak(List<ControlNode> nodes) {
        int endIndex = nodes.size();
        while (endIndex > 0) {
            ControlNode last = nodes.get(endIndex - 1);
            String text = last instanceof ControlNode.Statement statement
                ? StatementText.normalizeStatementText(statement.text())
                : null;
            if (!"break".equals(text)) {
                break;
            }
            endIndex--;
        }
        return endIndex == nodes.size() ? nodes : nodes.subList(0, endIndex);
    }

    /**
     * Whether the last renderable node of a case body is a terminating statement.
     */
    static boolean hasExplicitTerminator(List<ControlNode> nodes) {
        ControlNode last = null;
        for (int i = nodes.size() - 1; i >= 0; i--) {
            if (isRenderable(nodes.get(i))) {
                last = nodes.get(i);
                break;
            }
        }
        if (!(last instanceof ControlNode.Statement statement)) {
            return false;
        }
        return StatementText.isTerminatingStatement(StatementText.normalizeStatementText(statement.text()));
    }

    static boolean hasRenderableBody(List<ControlNode> nodes) {
        for (ControlNode node : nodes) {
            if (isRenderable(node)) {
                return true;
            }
        }
        return false;
    }

    static boolean isRenderable(ControlNode node) {
        if (node instanceof ControlNode.Statement statement) {
            return StatementText.normalizeStatementText(statement.text()) != null;
        }
        if (node instanceof ControlNode.Sequence sequence) {
            return hasRenderableBody(sequence.children());
        }
        return node != null;
    }
}
