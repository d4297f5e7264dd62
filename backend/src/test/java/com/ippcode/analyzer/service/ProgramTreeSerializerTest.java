package com.ippcode.analyzer.service;

import com.ippcode.analyzer.exception.SourceAnalysisException;
import com.ippcode.analyzer.model.ProgramTree;

import com.fasterxml.jackson.core.JsonProcessingException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProgramTreeSerializerTest {

    private final SourceAnalysisService service = SourceAnalysisServiceTest.createService();
    private final ProgramTreeSerializer serializer = new ProgramTreeSerializer();

    @Test
    void rendersProgramDocument() throws Exception {
        String xml = render("""
                .IPPcode24
                move GF@x string@a<b&c
                label int
                READ GF@x int
                BREAK
                """);

        assertThat(xml).startsWith("<?xml");
        assertThat(xml).contains("<program language=\"IPPcode24\">");
        assertThat(xml).contains("order=\"1\"").contains("opcode=\"MOVE\"");
        assertThat(xml).contains("<arg1 type=\"var\">GF@x</arg1>");
        assertThat(xml).contains("<arg2 type=\"string\">a&lt;b&amp;c</arg2>");
        assertThat(xml).contains("<arg1 type=\"label\">int</arg1>");
        assertThat(xml).contains("<arg2 type=\"type\">int</arg2>");
        assertThat(xml).doesNotContain("arg3");
    }

    @Test
    void keepsSourceOrder() throws Exception {
        String xml = render(".IPPcode24\nCREATEFRAME\nPUSHFRAME\nPOPFRAME\n");

        assertThat(xml.indexOf("CREATEFRAME")).isLessThan(xml.indexOf("PUSHFRAME"));
        assertThat(xml.indexOf("PUSHFRAME")).isLessThan(xml.indexOf("POPFRAME"));
        assertThat(xml).contains("order=\"3\"");
    }

    @Test
    void renderingIsByteIdentical() throws Exception {
        String first = render(SourceAnalysisServiceTest.FACTORIAL);
        String second = render(SourceAnalysisServiceTest.FACTORIAL);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void emptyProgramHasNoInstructions() throws Exception {
        ProgramTree tree = service.analyze(".IPPcode24").tree();

        assertThat(serializer.toElement(tree).getInstructions()).isEmpty();
        assertThat(serializer.toXml(tree)).contains("program").doesNotContain("<instruction");
    }

    private String render(String source) throws SourceAnalysisException, JsonProcessingException {
        return serializer.toXml(service.analyze(source).tree());
    }
}
