package com.nassikit.text;

import com.nassikit.tree.MethodInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the declaration line shown above a method's structogram.
 */
public final class MethodDeclarations {

    private static final Pattern PARAMETER_LIST = Pattern.compile("\\((.*)\\)");

    private MethodDeclarations() {
    }

    /**
     * Assemble {@code "<visibility> <static> <returnType> <name>(<params>)"}.
     * Name and parameters are taken from the raw signature when the structured data is missing.
     */
    public static String toMethodDeclaration(MethodInfo method) {
        String signature = method.signature() == null ? "" : method.signature();
        String visibility = normalizeVisibility(method.visibility());
        String staticToken = method.isStatic() ? "static" : "";
        String returnType = isBlank(method.returnType()) ? "void" : method.returnType().trim();
        String name = isBlank(method.name()) ? nameFromSignature(signature) : method.name().trim();
        String params = method.params().isEmpty() ? paramsFromSignature(signature) : joinParams(method.params());

        List<String> prefix = new ArrayList<>();
        for (String token : List.of(visibility, staticToken, returnType)) {
            if (!token.isEmpty()) {
                prefix.add(token);
            }
        }
        return (String.join(" ", prefix) + " " + name + "(" + params + ")").trim();
    }

    /**
     * Map UML symbols and Java keywords to a Java visibility keyword; anything else maps to "".
     */
    public static String normalizeVisibility(String visibility) {
        if (visibility == null) {
            return "";
        }
        return switch (visibility.trim()) {
            case "+", "public" -> "public";
            case "-", "private" -> "private";
            case "#", "protected" -> "protected";
            default -> "";
        };
    }

    static String nameFromSignature(String signature) {
        String namePart = signature.split("\\(", -1)[0].trim();
        String[] pieces = namePart.split("\\s+");
        String last = pieces[pieces.length - 1];
        return last.isEmpty() ? signature : last;
    }

    static String paramsFromSignature(String signature) {
        Matcher matcher = PARAMETER_LIST.matcher(signature);
        return matcher.find() ? matcher.group(1).trim() : "";
    }

    private static String joinParams(List<MethodInfo.Param> params) {
        List<String> parts = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            MethodInfo.Param param = params.get(i);
            String type = param.type() == null ? "" : param.type().trim();
            String name = param.name() == null ? "" : param.name().trim();
            if (!type.isEmpty() && !name.isEmpty()) {
                parts.add(type + " " + name);
            } else if (!type.isEmpty()) {
                parts.add(type);
            } else if (!name.isEmpty()) {
                parts.add(name);
            } else {
                parts.add("arg" + i);
            }
        }
        return String.join(", ", parts);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
