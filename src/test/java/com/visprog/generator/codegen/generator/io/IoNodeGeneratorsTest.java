package com.visprog.generator.codegen.generator.io;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.visprog.generator.codegen.generator.RecordingHelpers;
import com.visprog.generator.model.GraphNode;
import com.visprog.generator.model.StandardNodeType;
import com.visprog.generator.model.factory.NodeFactory;

import static org.assertj.core.api.Assertions.*;

class IoNodeGeneratorsTest {

    @Test
    void testPrintQuotesStringValue() {
        PrintNodeGenerator generator = new PrintNodeGenerator();
        GraphNode print = NodeFactory.create(StandardNodeType.PRINT, "print-1").withInputValue("string", "Hello");

        List<String> lines = generator.generate(print, RecordingHelpers.context(), new RecordingHelpers()).getLines();

        assertThat(lines).containsExactly("std::cout << \"Hello\" << std::endl;");
    }

    @Test
    void testPrintIndentsAtCurrentLevel() {
        PrintNodeGenerator generator = new PrintNodeGenerator();
        GraphNode print = NodeFactory.create(StandardNodeType.PRINT, "print-1");
        RecordingHelpers helpers = new RecordingHelpers().atIndent(2).input(print, "string", "i_abc");

        assertThat(generator.generate(print, RecordingHelpers.context(), helpers).getLines())
                .containsExactly("        std::cout << i_abc << std::endl;");
    }

    @Test
    void testInputWithPromptRegistersValue() {
        InputNodeGenerator generator = new InputNodeGenerator();
        GraphNode input = NodeFactory.create(StandardNodeType.INPUT, "input-1").withInputValue("prompt", "Name? ");
        RecordingHelpers helpers = new RecordingHelpers();

        List<String> lines = generator.generate(input, RecordingHelpers.context(), helpers).getLines();

        assertThat(lines).containsExactly(
                "std::cout << \"Name? \";",
                "std::string input_input1;",
                "std::cin >> input_input1;");
        assertThat(generator.getOutputExpression(input, "input-1-value", RecordingHelpers.context(), helpers))
                .contains("input_input1");
    }

    @Test
    void testInputWithoutPromptSkipsEcho() {
        InputNodeGenerator generator = new InputNodeGenerator();
        GraphNode input = NodeFactory.create(StandardNodeType.INPUT, "input-1");

        List<String> lines = generator.generate(input, RecordingHelpers.context(), new RecordingHelpers()).getLines();

        assertThat(lines).hasSize(2).noneMatch(line -> line.contains("std::cout"));
    }
}
