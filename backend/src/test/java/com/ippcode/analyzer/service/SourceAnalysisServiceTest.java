package com.ippcode.analyzer.service;

import com.ippcode.analyzer.config.AnalyzerProperties;
import com.ippcode.analyzer.exception.ErrorCategory;
import com.ippcode.analyzer.exception.SourceAnalysisException;
import com.ippcode.analyzer.model.Instruction;
import com.ippcode.analyzer.model.ProgramStatistics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceAnalysisServiceTest {

    static final String FACTORIAL = """
            .IPPcode24
            # factorial of a number read from input
            DEFVAR GF@n
            DEFVAR GF@result
            READ GF@n int
            MOVE GF@result int@1
            JUMP check            # forward
            LABEL loop
            MUL GF@result GF@result GF@n
            SUB GF@n GF@n int@1
            LABEL check
            JUMPIFNEQ loop GF@n int@0   # backward
            JUMPIFEQ missing GF@n int@0
            WRITE string@result:\\032
            WRITE GF@result
            """;

    private final SourceAnalysisService service = createService();

    static SourceAnalysisService createService() {
        AnalyzerProperties properties = new AnalyzerProperties();
        return new SourceAnalysisService(properties, new SourceTokenizer(properties),
                new InstructionClassifier(properties, new OperandValidator()));
    }

    @Test
    void instructionCountMatchesSignificantLines() throws SourceAnalysisException {
        AnalysisResult result = service.analyze(FACTORIAL);

        assertThat(result.tree().size()).isEqualTo(13);
        assertThat(result.tree().language()).isEqualTo("IPPcode24");
        assertThat(result.tree().instructions()).extracting(Instruction::order)
            .containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13);
        assertThat(result.tree().instructions().get(2).opcode()).isEqualTo("READ");
        assertThat(result.tree().instructions().get(2).line()).isEqualTo(5);
    }

    @Test
    void collectsStatistics() throws SourceAnalysisException {
        ProgramStatistics statistics = service.analyze(FACTORIAL).statistics();

        assertThat(statistics.linesOfCode()).isEqualTo(13);
        assertThat(statistics.comments()).isEqualTo(3);
        assertThat(statistics.labels()).isEqualTo(2);
        assertThat(statistics.jumps()).isEqualTo(3);
        assertThat(statistics.forwardJumps()).isEqualTo(1);
        assertThat(statistics.backwardJumps()).isEqualTo(1);
        assertThat(statistics.unresolvableJumps()).isEqualTo(1);
        assertThat(statistics.mostFrequentOpcodes()).containsExactly("DEFVAR", "LABEL", "WRITE");
    }

    @Test
    void analysisIsRepeatable() throws SourceAnalysisException {
        AnalysisResult first = service.analyze(FACTORIAL);
        AnalysisResult second = service.analyze(FACTORIAL);

        assertThat(second.tree()).isEqualTo(first.tree());
        assertThat(second.statistics()).isEqualTo(first.statistics());
    }

    @Test
    void missingHeaderAbortsBeforeAnyInstruction() {
        assertThatThrownBy(() -> service.analyze("DEFVAR GF@x\nWRITE GF@x\n"))
            .isInstanceOfSatisfying(SourceAnalysisException.class, e ->
                assertThat(e.getCategory()).isEqualTo(ErrorCategory.MISSING_OR_INVALID_HEADER));
    }

    @Test
    void firstErrorWins() {
        String source = """
                .IPPcode24
                DEFVAR GF@x
                WRITE string@bad\\1
                UNKNOWN
                """;

        assertThatThrownBy(() -> service.analyze(source))
            .isInstanceOfSatisfying(SourceAnalysisException.class, e -> {
                assertThat(e.getCategory()).isEqualTo(ErrorCategory.INVALID_ESCAPE_SEQUENCE);
                assertThat(e.getLine()).isEqualTo(3);
            });
    }

    @Test
    void headerOnlyProgramIsEmpty() throws SourceAnalysisException {
        AnalysisResult result = service.analyze(".IPPcode24\n");

        assertThat(result.tree().instructions()).isEmpty();
        assertThat(result.statistics().mostFrequentOpcodes()).isEmpty();
    }
}
