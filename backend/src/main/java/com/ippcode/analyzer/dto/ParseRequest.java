package com.ippcode.analyzer.dto;

import java.util.List;

import jakarta.validation.constraints.NotNull;

public record ParseRequest(
    @NotNull(message = "Source code cannot be null")
    String sourceCode,

    List<String> statisticsArguments
) {

    public List<String> statisticsArgumentsOrEmpty() {
        return statisticsArguments == null ? List.of() : statisticsArguments;
    }
}
