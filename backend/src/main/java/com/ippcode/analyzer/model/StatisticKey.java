package com.ippcode.analyzer.model;

import java.util.Arrays;
import java.util.Optional;

public enum StatisticKey {
    LOC("--loc"),
    COMMENTS("--comments"),
    LABELS("--labels"),
    JUMPS("--jumps"),
    FORWARD_JUMPS("--fwjumps"),
    BACKWARD_JUMPS("--backjumps"),
    BAD_JUMPS("--badjumps"),
    FREQUENT("--frequent");

    private final String option;

    StatisticKey(String option) {
        this.option = option;
    }

    public String option() {
        return option;
    }

    public static Optional<StatisticKey> fromOption(String option) {
        return Arrays.stream(values())
            .filter(key -> key.option.equals(option))
            .findFirst();
    }
}
