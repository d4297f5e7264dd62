package com.ippcode.analyzer.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

@JacksonXmlRootElement(localName = "program")
@JsonPropertyOrder({"language", "instruction"})
public class ProgramElement {

    private final String language;
    private final List<InstructionElement> instructions;

    public ProgramElement(String language, List<InstructionElement> instructions) {
        this.language = language;
        this.instructions = List.copyOf(instructions);
    }

    @JacksonXmlProperty(isAttribute = true)
    public String getLanguage() {
        return language;
    }

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "instruction")
    public List<InstructionElement> getInstructions() {
        return instructions;
    }
}
