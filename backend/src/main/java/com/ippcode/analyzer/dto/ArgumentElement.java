package com.ippcode.analyzer.dto;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

public class ArgumentElement {

    private final String type;
    private final String value;

    public ArgumentElement(String type, String value) {
        this.type = type;
        this.value = value;
    }

    @JacksonXmlProperty(isAttribute = true)
    public String getType() {
        return type;
    }

    @JacksonXmlText
    public String getValue() {
        return value;
    }
}
