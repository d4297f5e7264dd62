package com.ippcode.analyzer.service;

import com.ippcode.analyzer.model.ProgramStatistics;
import com.ippcode.analyzer.model.ProgramTree;

public record AnalysisResult(ProgramTree tree, ProgramStatistics statistics) {
}
