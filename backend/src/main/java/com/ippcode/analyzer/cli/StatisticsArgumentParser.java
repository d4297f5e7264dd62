package com.ippcode.analyzer.cli;

import com.ippcode.analyzer.exception.ArgumentsException;
import com.ippcode.analyzer.model.StatisticItem;
import com.ippcode.analyzer.model.StatisticKey;
import com.ippcode.analyzer.model.StatisticsTarget;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads {@code --stats=FILE} groups. Every option after a {@code --stats} belongs
 * to that file until the next one.
 */
@Component
public class StatisticsArgumentParser {

    private static final String STATS_PREFIX = "--stats=";
    private static final String PRINT_PREFIX = "--print=";
    private static final String EOL = "--eol";

    public List<StatisticsTarget> parse(List<String> arguments) throws ArgumentsException {
        Map<String, List<StatisticItem>> groups = new LinkedHashMap<>();
        String current = null;

        for (String argument : arguments) {
            if (argument.startsWith(STATS_PREFIX)) {
                current = argument.substring(STATS_PREFIX.length());
                if (current.isEmpty()) {
                    throw new ArgumentsException(ArgumentsException.INVALID_ARGUMENTS,
                            "Missing file name in " + argument);
                }
                if (groups.containsKey(current)) {
                    throw new ArgumentsException(ArgumentsException.OUTPUT_FILE_ERROR,
                            "Duplicate --stats file " + current);
                }
                groups.put(current, new ArrayList<>());
                continue;
            }

            StatisticItem item = parseItem(argument);
            if (current == null) {
                throw new ArgumentsException(ArgumentsException.INVALID_ARGUMENTS,
                        "--stats parameter is missing before " + argument);
            }
            groups.get(current).add(item);
        }

        List<StatisticsTarget> targets = new ArrayList<>();
        groups.forEach((destination, items) -> targets.add(new StatisticsTarget(destination, items)));
        return targets;
    }

    private StatisticItem parseItem(String argument) throws ArgumentsException {
        if (argument.startsWith(PRINT_PREFIX)) {
            return StatisticItem.print(argument.substring(PRINT_PREFIX.length()));
        }
        if (EOL.equals(argument)) {
            return StatisticItem.emptyLine();
        }

        Optional<StatisticKey> key = StatisticKey.fromOption(argument);
        if (key.isEmpty()) {
            throw new ArgumentsException(ArgumentsException.INVALID_ARGUMENTS, "Unknown parameter " + argument);
        }
        return StatisticItem.counter(key.get());
    }
}
