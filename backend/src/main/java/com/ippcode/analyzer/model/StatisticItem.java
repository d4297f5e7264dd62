package com.ippcode.analyzer.model;

/**
 * One line requested in a statistics file: a counter, a literal text, or an empty line.
 */
public record StatisticItem(StatisticKey key, String text) {

    public static StatisticItem counter(StatisticKey key) {
        return new StatisticItem(key, null);
    }

    public static StatisticItem print(String text) {
        return new StatisticItem(null, text);
    }

    public static StatisticItem emptyLine() {
        return new StatisticItem(null, "");
    }

    public boolean isCounter() {
        return key != null;
    }
}
