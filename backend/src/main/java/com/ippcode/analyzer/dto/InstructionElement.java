package com.ippcode.analyzer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"order", "opcode", "arg1", "arg2", "arg3"})
public class InstructionElement {

    private final int order;
    private final String opcode;
    private final ArgumentElement arg1;
    private final ArgumentElement arg2;
    private final ArgumentElement arg3;

    public InstructionElement(int order, String opcode,
                              ArgumentElement arg1, ArgumentElement arg2, ArgumentElement arg3) {
        this.order = order;
        this.opcode = opcode;
        this.arg1 = arg1;
        this.arg2 = arg2;
        this.arg3 = arg3;
    }

    @JacksonXmlProperty(isAttribute = true)
    public int getOrder() {
        return order;
    }

    @JacksonXmlProperty(isAttribute = true)
    public String getOpcode() {
        return opcode;
    }

    @JacksonXmlProperty(localName = "arg1")
    public ArgumentElement getArg1() {
        return arg1;
    }

    @JacksonXmlProperty(localName = "arg2")
    public ArgumentElement getArg2() {
        return arg2;
    }

    @JacksonXmlProperty(localName = "arg3")
    public ArgumentElement getArg3() {
        return arg3;
    }
}
