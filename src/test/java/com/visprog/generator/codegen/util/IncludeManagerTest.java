package com.visprog.generator.codegen.util;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class IncludeManagerTest {

    @Test
    void testNormalizesAndDeduplicates() {
        IncludeManager includes = new IncludeManager();

        includes.addInclude("<vector>");
        includes.addInclude("#include <vector>");
        includes.addInclude("cmath");
        includes.addInclude("\"my.h\"");
        includes.addInclude("  ");
        includes.addInclude(null);

        assertThat(includes.getIncludes()).containsExactly("\"my.h\"", "<cmath>", "<vector>");
        assertThat(includes.contains("<cmath>")).isTrue();
    }

    @Test
    void testGenerateIncludes() {
        IncludeManager includes = new IncludeManager();
        includes.addIncludes(List.of("<string>", "<iostream>"));

        assertThat(includes.generateIncludes()).containsExactly("#include <iostream>", "#include <string>");
    }
}
