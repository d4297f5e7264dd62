package com.ippcode.analyzer.service;

import com.ippcode.analyzer.dto.ArgumentElement;
import com.ippcode.analyzer.dto.InstructionElement;
import com.ippcode.analyzer.dto.ProgramElement;
import com.ippcode.analyzer.model.Instruction;
import com.ippcode.analyzer.model.Operand;
import com.ippcode.analyzer.model.ProgramTree;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a {@link ProgramTree} as the XML program document.
 */
@Component
public class ProgramTreeSerializer {

    private final XmlMapper xmlMapper = XmlMapper.builder()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(ToXmlGenerator.Feature.WRITE_XML_DECLARATION)
        .build();

    public String toXml(ProgramTree tree) throws JsonProcessingException {
        return xmlMapper.writeValueAsString(toElement(tree));
    }

    public ProgramElement toElement(ProgramTree tree) {
        List<InstructionElement> instructions = tree.instructions().stream()
            .map(this::toElement)
            .collect(Collectors.toList());
        return new ProgramElement(tree.language(), instructions);
    }

    private InstructionElement toElement(Instruction instruction) {
        List<Operand> operands = instruction.operands();
        return new InstructionElement(
                instruction.order(),
                instruction.opcode(),
                argument(operands, 0),
                argument(operands, 1),
                argument(operands, 2));
    }

    private ArgumentElement argument(List<Operand> operands, int index) {
        if (index >= operands.size()) {
            return null;
        }
        Operand operand = operands.get(index);
        return new ArgumentElement(operand.typeAttribute(), operand.value());
    }
}
