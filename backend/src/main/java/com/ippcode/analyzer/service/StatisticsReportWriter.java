package com.ippcode.analyzer.service;

import com.ippcode.analyzer.model.ProgramStatistics;
import com.ippcode.analyzer.model.StatisticItem;
import com.ippcode.analyzer.model.StatisticKey;
import com.ippcode.analyzer.model.StatisticsTarget;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders requested statistics, one item per line in the requested order.
 */
@Component
public class StatisticsReportWriter {

    public Map<String, String> render(ProgramStatistics statistics, List<StatisticsTarget> targets) {
        Map<String, String> reports = new LinkedHashMap<>();
        for (StatisticsTarget target : targets) {
            reports.put(target.destination(), render(statistics, target));
        }
        return reports;
    }

    public String render(ProgramStatistics statistics, StatisticsTarget target) {
        StringBuilder report = new StringBuilder();
        for (StatisticItem item : target.items()) {
            report.append(item.isCounter() ? value(statistics, item.key()) : item.text()).append('\n');
        }
        return report.toString();
    }

    public String value(ProgramStatistics statistics, StatisticKey key) {
        return switch (key) {
            case LOC -> String.valueOf(statistics.linesOfCode());
            case COMMENTS -> String.valueOf(statistics.comments());
            case LABELS -> String.valueOf(statistics.labels());
            case JUMPS -> String.valueOf(statistics.jumps());
            case FORWARD_JUMPS -> String.valueOf(statistics.forwardJumps());
            case BACKWARD_JUMPS -> String.valueOf(statistics.backwardJumps());
            case BAD_JUMPS -> String.valueOf(statistics.unresolvableJumps());
            case FREQUENT -> String.join(",", statistics.mostFrequentOpcodes());
        };
    }
}
