package com.ippcode.analyzer.service;

import com.ippcode.analyzer.config.AnalyzerProperties;
import com.ippcode.analyzer.exception.SourceAnalysisException;
import com.ippcode.analyzer.model.Instruction;
import com.ippcode.analyzer.model.SourceLine;
import com.ippcode.analyzer.model.TokenizedSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the whole front end over one source text: tokenizer, classifier and
 * validator, with the tree builder and statistics engine observing each
 * validated instruction. The first error aborts the run and nothing partial
 * is returned.
 */
@Service
public class SourceAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(SourceAnalysisService.class);

    private final AnalyzerProperties properties;
    private final SourceTokenizer tokenizer;
    private final InstructionClassifier classifier;

    public SourceAnalysisService(AnalyzerProperties properties,
                                 SourceTokenizer tokenizer,
                                 InstructionClassifier classifier) {
        this.properties = properties;
        this.tokenizer = tokenizer;
        this.classifier = classifier;
    }

    public AnalysisResult analyze(String sourceCode) throws SourceAnalysisException {
        long startTime = System.currentTimeMillis();

        TokenizedSource source = tokenizer.tokenize(sourceCode);

        ProgramTreeBuilder treeBuilder = new ProgramTreeBuilder(properties.language());
        StatisticsEngine statistics = new StatisticsEngine();
        statistics.recordComments(source.commentLines());

        for (SourceLine line : source.lines()) {
            Instruction instruction = classifier.classify(line, treeBuilder.nextOrder());
            logger.debug("Line {}: {} with {} operand(s)", line.lineNumber(), instruction.opcode(),
                    instruction.operands().size());

            treeBuilder.append(instruction);
            statistics.observe(instruction);
        }

        AnalysisResult result = new AnalysisResult(treeBuilder.build(), statistics.resolve());
        logger.info("Analyzed {} instructions in {}ms", result.tree().size(),
                System.currentTimeMillis() - startTime);
        return result;
    }
}
