package com.ippcode.analyzer.cli;

import com.ippcode.analyzer.exception.ArgumentsException;
import com.ippcode.analyzer.exception.SourceAnalysisException;
import com.ippcode.analyzer.model.StatisticsTarget;
import com.ippcode.analyzer.service.AnalysisResult;
import com.ippcode.analyzer.service.ProgramTreeSerializer;
import com.ippcode.analyzer.service.SourceAnalysisService;
import com.ippcode.analyzer.service.StatisticsReportWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Filter-style front end: source on standard input, XML on standard output,
 * statistics into the files named by {@code --stats}.
 */
@Component
public class ParseCommand {

    private static final Logger logger = LoggerFactory.getLogger(ParseCommand.class);

    public static final int SUCCESS = 0;
    public static final int INTERNAL_ERROR = 99;

    static final String USAGE = """
            Usage: parse [--help] [--stats=FILE [STAT]...]...
            Reads IPPcode24 source from standard input, checks its lexical and syntactic
            correctness and writes the XML representation of the program to standard output.

              --help            print this message
              --stats=FILE      write the statistics that follow into FILE
              --loc             number of instructions
              --comments        number of lines with a comment
              --labels          number of distinct labels
              --jumps           number of jump and call instructions
              --fwjumps         number of forward jumps
              --backjumps       number of backward jumps
              --badjumps        number of jumps to a label that does not exist
              --frequent        most frequent opcodes, comma separated
              --print=TEXT      write TEXT
              --eol             write an empty line
            """;

    private final SourceAnalysisService analysisService;
    private final ProgramTreeSerializer serializer;
    private final StatisticsArgumentParser argumentParser;
    private final StatisticsReportWriter reportWriter;

    public ParseCommand(SourceAnalysisService analysisService,
                        ProgramTreeSerializer serializer,
                        StatisticsArgumentParser argumentParser,
                        StatisticsReportWriter reportWriter) {
        this.analysisService = analysisService;
        this.serializer = serializer;
        this.argumentParser = argumentParser;
        this.reportWriter = reportWriter;
    }

    public int run(List<String> arguments, InputStream in, PrintStream out, PrintStream err) {
        if (arguments.contains("--help")) {
            if (arguments.size() != 1) {
                err.println("Error " + ArgumentsException.INVALID_ARGUMENTS + ": --help cannot be combined with other parameters");
                return ArgumentsException.INVALID_ARGUMENTS;
            }
            out.print(USAGE);
            return SUCCESS;
        }

        try {
            List<StatisticsTarget> targets = argumentParser.parse(arguments);
            String sourceCode = readSource(in);

            AnalysisResult result = analysisService.analyze(sourceCode);

            String xml = serializer.toXml(result.tree());
            writeStatistics(reportWriter.render(result.statistics(), targets));

            // the document declares UTF-8 whatever the stream's own charset is
            byte[] document = xml.getBytes(StandardCharsets.UTF_8);
            out.write(document, 0, document.length);
            out.flush();
            return SUCCESS;

        } catch (ArgumentsException e) {
            err.println("Error " + e.getExitCode() + ": " + e.getMessage());
            return e.getExitCode();
        } catch (SourceAnalysisException e) {
            logger.debug("Source rejected: {} at line {}", e.getCategory(), e.getLine());
            err.println("Error " + e.getExitCode() + " (" + e.getCategory() + ") at line " + e.getLine()
                    + ": " + e.getMessage());
            return e.getExitCode();
        } catch (IOException e) {
            logger.error("Failed to render program tree: {}", e.getMessage(), e);
            err.println("Error " + INTERNAL_ERROR + ": " + e.getMessage());
            return INTERNAL_ERROR;
        }
    }

    private String readSource(InputStream in) throws ArgumentsException {
        try {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArgumentsException(ArgumentsException.INPUT_FILE_ERROR,
                    "Failed to read source: " + e.getMessage(), e);
        }
    }

    /**
     * Writes every report or none: when one file fails, the ones already written are removed.
     */
    private void writeStatistics(Map<String, String> reports) throws ArgumentsException {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, String> report : reports.entrySet()) {
            Path file = Path.of(report.getKey());
            try {
                Files.writeString(file, report.getValue(), StandardCharsets.UTF_8);
                written.add(file);
                logger.debug("Wrote statistics to {}", file);
            } catch (IOException e) {
                removeWritten(written);
                throw new ArgumentsException(ArgumentsException.OUTPUT_FILE_ERROR,
                        "Failed to write statistics to " + file + ": " + e.getMessage(), e);
            }
        }
    }

    private void removeWritten(List<Path> files) {
        for (Path file : files) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                logger.warn("Failed to remove partial statistics file {}: {}", file, e.getMessage());
            }
        }
    }
}
