package com.nassikit.tree;

import java.util.Arrays;
import java.util.List;

/**
 * Sealed interface for the nodes of a method's control-flow tree.
 * The tree is produced by an external static analyzer and is immutable;
 * the layout engine only reads it.
 */
public sealed interface ControlNode permits
        ControlNode.Statement,
        ControlNode.Sequence,
        ControlNode.If,
        ControlNode.Loop,
        ControlNode.Switch,
        ControlNode.Try,
        ControlNode.Unknown {

    /**
     * The analyzer's tag for this node ("statement", "if", ...).
     */
    String kind();

    /**
     * Plain statement, kept as source text.
     */
    record Statement(String text) implements ControlNode {
        public static Statement of(String text) {
            return new Statement(text);
        }

        @Override
        public String kind() {
            return "statement";
        }
    }

    /**
     * Block of statements executed in order.
     */
    record Sequence(List<ControlNode> children) implements ControlNode {
        public Sequence {
            children = copy(children);
        }

        public static Sequence of(ControlNode... children) {
            return new Sequence(Arrays.asList(children));
        }

        @Override
        public String kind() {
            return "sequence";
        }
    }

    /**
     * Binary decision. An empty else branch means the source had no else.
     */
    record If(String condition, List<ControlNode> thenBranch, List<ControlNode> elseBranch) implements ControlNode {
        public If {
            thenBranch = copy(thenBranch);
            elseBranch = copy(elseBranch);
        }

        public static If simple(String condition, List<ControlNode> thenBranch) {
            return new If(condition, thenBranch, List.of());
        }

        public static If withElse(String condition, List<ControlNode> thenBranch, List<ControlNode> elseBranch) {
            return new If(condition, thenBranch, elseBranch);
        }

        @Override
        public String kind() {
            return "if";
        }
    }

    /**
     * Loop of any kind. The loop kind is the analyzer's name for it
     * ("while", "for", "foreach", "doWhile").
     */
    record Loop(String loopKind, String condition, List<ControlNode> children) implements ControlNode {
        public static final String WHILE = "while";
        public static final String FOR = "for";
        public static final String FOREACH = "foreach";
        public static final String DO_WHILE = "doWhile";

        public Loop {
            children = copy(children);
        }

        public static Loop of(String loopKind, String condition, List<ControlNode> children) {
            return new Loop(loopKind, condition, children);
        }

        /**
         * Post-test loops are drawn with a footer instead of a left inset.
         */
        public boolean isPostTest() {
            return isPostTestKind(loopKind);
        }

        public static boolean isPostTestKind(String loopKind) {
            return loopKind != null && DO_WHILE.equals(loopKind.trim());
        }

        @Override
        public String kind() {
            return "loop";
        }
    }

    /**
     * Switch statement. Cases are kept in source order, including fallthrough labels without a body.
     */
    record Switch(String condition, List<SwitchCase> cases) implements ControlNode {
        public Switch {
            cases = copy(cases);
        }

        public static Switch of(String condition, SwitchCase... cases) {
            return new Switch(condition, Arrays.asList(cases));
        }

        @Override
        public String kind() {
            return "switch";
        }
    }

    record SwitchCase(String label, List<ControlNode> body) {
        public SwitchCase {
            body = copy(body);
        }

        public static SwitchCase of(String label, ControlNode... body) {
            return new SwitchCase(label, Arrays.asList(body));
        }
    }

    /**
     * Try statement with its catch clauses and optional finally block.
     * An empty finally list means there is no finally block.
     */
    record Try(List<ControlNode> children, List<CatchClause> catches, List<ControlNode> finallyBranch) implements ControlNode {
        public Try {
            children = copy(children);
            catches = copy(catches);
            finallyBranch = copy(finallyBranch);
        }

        @Override
        public String kind() {
            return "try";
        }
    }

    record CatchClause(String exception, List<ControlNode> body) {
        public CatchClause {
            body = copy(body);
        }
    }

    /**
     * A tag the analyzer emitted that has no dedicated node type.
     */
    record Unknown(String kind, String text) implements ControlNode {
    }

    private static <T> List<T> copy(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        // List.copyOf rejects null elements, the analyzer may emit them
        return values.stream().filter(value -> value != null).toList();
    }
}
