package com.ippcode.analyzer.model;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Frozen counters of one analysis run.
 */
public record ProgramStatistics(
        int linesOfCode,
        int comments,
        int labels,
        int duplicateLabels,
        int jumps,
        int backwardJumps,
        int forwardJumps,
        int unresolvableJumps,
        Map<String, Integer> opcodeFrequencies) {

    public ProgramStatistics {
        opcodeFrequencies = Map.copyOf(opcodeFrequencies);
    }

    /**
     * Opcodes sharing the highest count, alphabetically.
     */
    public List<String> mostFrequentOpcodes() {
        int max = opcodeFrequencies.values().stream()
            .mapToInt(Integer::intValue)
            .max()
            .orElse(0);

        return opcodeFrequencies.entrySet().stream()
            .filter(entry -> entry.getValue() == max)
            .map(Map.Entry::getKey)
            .sorted()
            .collect(Collectors.toList());
    }
}
