package com.visprog.generator.codegen.render;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CppSourceRendererTest {

    private final CppSourceRenderer renderer = new CppSourceRenderer();

    @Test
    void testRendersSectionsInOrder() {
        CppTranslationUnit unit = CppTranslationUnit.builder()
                .includeHeaders(true)
                .graphName("Demo")
                .include("<iostream>")
                .include("<tuple>")
                .resultType("using fResult = std::tuple<int, int>;")
                .forwardDeclaration("fResult f()")
                .mainLines(List.of("int main() {", "    return 0;", "}"))
                .functionUnit(List.of("fResult f() {", "    return fResult{1, 2};", "}"))
                .build();

        String code = renderer.render(unit);

        assertThat(code).isEqualTo("""
                // Сгенерировано MultiCode
                // Граф: Demo

                #include <iostream>
                #include <tuple>

                using fResult = std::tuple<int, int>;

                fResult f();

                int main() {
                    return 0;
                }

                fResult f() {
                    return fResult{1, 2};
                }
                """);
    }

    @Test
    void testWithoutHeadersOnlyBodyIsRendered() {
        CppTranslationUnit unit = CppTranslationUnit.builder()
                .includeHeaders(false)
                .include("<iostream>")
                .mainLines(List.of("std::cout << x << std::endl;"))
                .build();

        assertThat(renderer.render(unit)).isEqualTo("std::cout << x << std::endl;\n");
    }

    @Test
    void testTimestampLineOnlyWhenSet() {
        CppTranslationUnit unit = CppTranslationUnit.builder()
                .includeHeaders(true)
                .graphName("g")
                .generatedAt("2024-01-02T03:04:05")
                .build();

        assertThat(renderer.render(unit)).contains("// Дата: 2024-01-02T03:04:05\n");
    }
}
