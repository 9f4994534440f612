package com.nassikit.tree;

import java.util.List;

/**
 * Method (or constructor) as reported by the analyzer, together with its control-flow tree.
 * Any field may be missing; {@code controlTree} is null when the analyzer produced none.
 */
public record MethodInfo(
    String visibility,
    boolean isStatic,
    String returnType,
    String name,
    List<Param> params,
    String signature,
    ControlNode controlTree
) {

    public MethodInfo {
        params = params == null ? List.of() : params.stream().filter(param -> param != null).toList();
    }

    /**
     * Method parameter. Either part may be blank.
     */
    public record Param(String type, String name) {
    }

    /**
     * Method known only by its raw signature, e.g. {@code "sum(int a, int b)"}.
     */
    public static MethodInfo fromSignature(String signature, ControlNode controlTree) {
        return new MethodInfo(null, false, null, null, List.of(), signature, controlTree);
    }

    public boolean hasControlTree() {
        return controlTree != null;
    }

    /**
     * Builder for method records assembled field by field.
     */
    public static class Builder {
        private String visibility;
        private boolean isStatic;
        private String returnType;
        private String name;
        private List<Param> params = List.of();
        private String signature;
        private ControlNode controlTree;

        public Builder visibility(String visibility) {
            this.visibility = visibility;
            return this;
        }

        public Builder setStatic(boolean isStatic) {
            this.isStatic = isStatic;
            return this;
        }

        public Builder returnType(String returnType) {
            this.returnType = returnType;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder params(List<Param> params) {
            this.params = params;
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public Builder controlTree(ControlNode controlTree) {
            this.controlTree = controlTree;
            return this;
        }

        public MethodInfo build() {
            return new MethodInfo(visibility, isStatic, returnType, name, params, signature, controlTree);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
