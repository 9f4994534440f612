package com.nassikit.text;

import com.nassikit.tree.MethodInfo;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MethodDeclarationsTest {

    @Test
    void structuredMethod_isAssembledInOrder() {
        MethodInfo method = MethodInfo.builder()
            .visibility("+")
            .setStatic(true)
            .returnType("int")
            .name("sum")
            .params(List.of(new MethodInfo.Param("int", "a"), new MethodInfo.Param("int", "b")))
            .signature("sum(int, int)")
            .build();

        assertEquals("public static int sum(int a, int b)", MethodDeclarations.toMethodDeclaration(method));
    }

    @Test
    void missingStructuredData_fallsBackToSignature() {
        MethodInfo method = MethodInfo.fromSignature("sum(int a, int b)", null);

        assertEquals("void sum(int a, int b)", MethodDeclarations.toMethodDeclaration(method));
    }

    @Test
    void nameFromSignature_takesLastWordBeforeParenthesis() {
        MethodInfo method = MethodInfo.builder()
            .visibility("#")
            .signature("String describe( )")
            .returnType("String")
            .build();

        assertEquals("protected String describe()", MethodDeclarations.toMethodDeclaration(method));
    }

    @Test
    void partialParameters_useWhateverIsPresent() {
        MethodInfo method = MethodInfo.builder()
            .visibility("private")
            .name("run")
            .params(List.of(
                new MethodInfo.Param(null, null),
                new MethodInfo.Param("String", " "),
                new MethodInfo.Param("", "count")))
            .build();

        assertEquals("private void run(arg0, String, count)", MethodDeclarations.toMethodDeclaration(method));
    }

    @Test
    void visibility_mapsSymbolsAndKeywords() {
        assertEquals("public", MethodDeclarations.normalizeVisibility("+"));
        assertEquals("private", MethodDeclarations.normalizeVisibility(" - "));
        assertEquals("protected", MethodDeclarations.normalizeVisibility("protected"));
        assertEquals("", MethodDeclarations.normalizeVisibility("~"));
        assertEquals("", MethodDeclarations.normalizeVisibility(null));
    }
}
