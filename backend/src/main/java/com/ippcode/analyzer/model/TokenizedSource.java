package com.ippcode.analyzer.model;

import java.util.List;

/**
 * Lines that survived comment stripping, header excluded, plus the number of
 * raw lines that carried a comment.
 */
public record TokenizedSource(List<SourceLine> lines, int commentLines) {

    public TokenizedSource {
        lines = List.copyOf(lines);
    }
}
