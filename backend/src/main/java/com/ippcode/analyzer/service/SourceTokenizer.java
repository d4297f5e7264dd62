package com.ippcode.analyzer.service;

import com.ippcode.analyzer.config.AnalyzerProperties;
import com.ippcode.analyzer.exception.ErrorCategory;
import com.ippcode.analyzer.exception.SourceAnalysisException;
import com.ippcode.analyzer.model.SourceLine;
import com.ippcode.analyzer.model.Token;
import com.ippcode.analyzer.model.TokenizedSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits source text into token lines, strips comments and blank lines and
 * consumes the mandatory header.
 */
@Component
public class SourceTokenizer {

    private static final Logger logger = LoggerFactory.getLogger(SourceTokenizer.class);

    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");

    private final AnalyzerProperties properties;

    public SourceTokenizer(AnalyzerProperties properties) {
        this.properties = properties;
    }

    public TokenizedSource tokenize(String sourceCode) throws SourceAnalysisException {
        String normalized = normalize(sourceCode);
        String commentMarker = properties.commentMarker();

        List<SourceLine> lines = new ArrayList<>();
        int commentLines = 0;

        String[] rawLines = normalized.split("\n", -1);
        for (int index = 0; index < rawLines.length; index++) {
            String content = rawLines[index];

            int commentStart = content.indexOf(commentMarker);
            if (commentStart >= 0) {
                commentLines++;
                content = content.substring(0, commentStart);
            }

            List<Token> tokens = splitTokens(content, index + 1);
            if (!tokens.isEmpty()) {
                lines.add(new SourceLine(index + 1, tokens));
            }
        }

        List<SourceLine> instructions = consumeHeader(lines);
        logger.debug("Tokenized {} raw lines into {} instruction lines ({} with comments)",
                rawLines.length, instructions.size(), commentLines);

        return new TokenizedSource(instructions, commentLines);
    }

    private List<SourceLine> consumeHeader(List<SourceLine> lines) throws SourceAnalysisException {
        if (lines.isEmpty()) {
            throw new SourceAnalysisException(ErrorCategory.MISSING_OR_INVALID_HEADER, 0,
                    "Missing header " + properties.header() + " in the source code");
        }

        SourceLine headerLine = lines.get(0);
        Token header = headerLine.first();
        if (!header.text().equalsIgnoreCase(properties.header())) {
            throw new SourceAnalysisException(ErrorCategory.MISSING_OR_INVALID_HEADER, header.line(),
                    "Expected header " + properties.header() + " but found '" + header.text() + "'");
        }
        if (headerLine.tokens().size() > 1) {
            throw new SourceAnalysisException(ErrorCategory.MISSING_OR_INVALID_HEADER, header.line(),
                    "Unexpected '" + headerLine.tokens().get(1).text() + "' after header");
        }

        return lines.subList(1, lines.size());
    }

    private List<Token> splitTokens(String content, int lineNumber) {
        List<Token> tokens = new ArrayList<>();
        for (String text : WHITESPACE_PATTERN.split(content.strip())) {
            if (!text.isEmpty()) {
                tokens.add(new Token(text, lineNumber));
            }
        }
        return tokens;
    }

    private String normalize(String sourceCode) {
        if (sourceCode == null) {
            return "";
        }

        return sourceCode
            .replace("\0", "")
            .replace("\r\n", "\n")
            .replace("\r", "\n");
    }
}
