package com.ippcode.analyzer.controller;

import com.ippcode.analyzer.cli.StatisticsArgumentParser;
import com.ippcode.analyzer.config.AnalyzerProperties;
import com.ippcode.analyzer.dto.ParseRequest;
import com.ippcode.analyzer.dto.ParseResponse;
import com.ippcode.analyzer.exception.ArgumentsException;
import com.ippcode.analyzer.exception.SourceAnalysisException;
import com.ippcode.analyzer.model.StatisticsTarget;
import com.ippcode.analyzer.service.AnalysisResult;
import com.ippcode.analyzer.service.ProgramTreeSerializer;
import com.ippcode.analyzer.service.SourceAnalysisService;
import com.ippcode.analyzer.service.StatisticsReportWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Validated
public class ParseController {

    private static final Logger logger = LoggerFactory.getLogger(ParseController.class);

    private final AnalyzerProperties properties;
    private final SourceAnalysisService analysisService;
    private final ProgramTreeSerializer serializer;
    private final StatisticsArgumentParser argumentParser;
    private final StatisticsReportWriter reportWriter;

    public ParseController(AnalyzerProperties properties,
                           SourceAnalysisService analysisService,
                           ProgramTreeSerializer serializer,
                           StatisticsArgumentParser argumentParser,
                           StatisticsReportWriter reportWriter) {
        this.properties = properties;
        this.analysisService = analysisService;
        this.serializer = serializer;
        this.argumentParser = argumentParser;
        this.reportWriter = reportWriter;
    }

    @PostMapping(value = "/parse", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ParseResponse> parse(@Valid @RequestBody ParseRequest request) {
        logger.info("Received parse request (length: {} chars)", request.sourceCode().length());

        if (request.sourceCode().length() > properties.maxSourceCodeLength()) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(ParseResponse.argumentsError(ArgumentsException.INVALID_ARGUMENTS, sourceTooLong()));
        }

        long startTime = System.currentTimeMillis();

        try {
            List<StatisticsTarget> targets = argumentParser.parse(request.statisticsArgumentsOrEmpty());
            AnalysisResult result = analysisService.analyze(request.sourceCode());

            String xml = serializer.toXml(result.tree());
            Map<String, String> statistics = reportWriter.render(result.statistics(), targets);

            return ResponseEntity.ok(ParseResponse.success(xml, statistics, System.currentTimeMillis() - startTime));

        } catch (ArgumentsException e) {
            logger.warn("Invalid statistics arguments: {}", e.getMessage());
            return ResponseEntity.badRequest().body(ParseResponse.argumentsError(e.getExitCode(), e.getMessage()));
        } catch (SourceAnalysisException e) {
            logger.info("Source rejected - Category: {}, Line: {}", e.getCategory(), e.getLine());
            ParseResponse response = ParseResponse.sourceError(e.getCategory().name(), e.getExitCode(), e.getLine(),
                    e.getMessage(), System.currentTimeMillis() - startTime);
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
        } catch (Exception e) {
            logger.error("Unexpected error during parsing: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(ParseResponse.internalError("Internal server error: " + e.getMessage()));
        }
    }

    @PostMapping(value = "/parse/xml", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> parseToXml(@RequestBody String sourceCode) {
        if (sourceCode.length() > properties.maxSourceCodeLength()) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .contentType(MediaType.TEXT_PLAIN)
                .body(sourceTooLong());
        }

        try {
            AnalysisResult result = analysisService.analyze(sourceCode);
            return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_XML)
                .body(serializer.toXml(result.tree()));

        } catch (SourceAnalysisException e) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .contentType(MediaType.TEXT_PLAIN)
                .body(e.getCategory() + " (" + e.getExitCode() + "): " + e.getMessage());
        } catch (Exception e) {
            logger.error("Unexpected error during parsing: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .contentType(MediaType.TEXT_PLAIN)
                .body("Internal server error: " + e.getMessage());
        }
    }

    private String sourceTooLong() {
        return "Source code exceeds maximum length of " + properties.maxSourceCodeLength() + " characters";
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("IPPcode24 analyzer is healthy");
    }

    @ExceptionHandler(org.springframework.web.bind.MethodArgumentNotValidException.class)
    public ResponseEntity<ParseResponse> handleValidationException(
            org.springframework.web.bind.MethodArgumentNotValidException e) {

        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest()
            .body(ParseResponse.argumentsError(ArgumentsException.INVALID_ARGUMENTS, errorMessage.toString()));
    }
}
