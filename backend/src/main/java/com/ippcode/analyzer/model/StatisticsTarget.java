package com.ippcode.analyzer.model;

import java.util.List;

public record StatisticsTarget(String destination, List<StatisticItem> items) {

    public StatisticsTarget {
        items = List.copyOf(items);
    }
}
