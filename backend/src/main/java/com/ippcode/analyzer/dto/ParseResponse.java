package com.ippcode.analyzer.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParseResponse(
        boolean success,
        String xml,
        Map<String, String> statistics,
        String errorCategory,
        Integer exitCode,
        Integer line,
        String error,
        long analysisTimeMs) {

    public static ParseResponse success(String xml, Map<String, String> statistics, long analysisTimeMs) {
        return new ParseResponse(true, xml, statistics, null, 0, null, null, analysisTimeMs);
    }

    public static ParseResponse sourceError(String category, int exitCode, int line, String error,
                                            long analysisTimeMs) {
        return new ParseResponse(false, null, null, category, exitCode, line, error, analysisTimeMs);
    }

    public static ParseResponse argumentsError(int exitCode, String error) {
        return new ParseResponse(false, null, null, "INVALID_ARGUMENTS", exitCode, null, error, 0);
    }

    public static ParseResponse internalError(String error) {
        return new ParseResponse(false, null, null, "INTERNAL_ERROR", null, null, error, 0);
    }
}
